package com.e2eq.hooks.model.hooks;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.util.List;
import java.util.Map;

/**
 * Input contracts of the sixteen lifecycle hooks. Each hook's payload is bound to
 * one of these records and validated before any script sees it; unknown fields are
 * dropped so scripts only ever receive the documented shape.
 */
public final class HookInputs {

    private HookInputs() {
    }

    // shared fragments

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RequestInfo(String ip, String userAgent, String origin) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PipelineUser(@NotNull String id, String email, String name, String role) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PipelineSession(@NotNull String id, @NotNull String userId, String expiresAt) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PipelineApiKey(@NotNull String id, String name, @NotNull String userId, List<String> permissions) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OAuthClient(@NotNull String clientId,
                              String name,
                              @Pattern(regexp = "public|confidential") String type,
                              String redirectUri) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConsentGrant(@NotNull List<String> scopes) {
    }

    // authentication

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BeforeSignup(@NotNull @Email String email, String name, @NotNull @Valid RequestInfo request) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AfterSignup(@NotNull @Valid PipelineUser user, @NotNull @Valid RequestInfo request) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BeforeSignin(@NotNull @Email String email, @NotNull @Valid RequestInfo request) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AfterSignin(@NotNull @Valid PipelineUser user, @NotNull @Valid PipelineSession session) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BeforeSignout(@NotNull @Valid PipelineUser user, @NotNull @Valid PipelineSession session) {
    }

    /** {@code token} carries the claims built so far. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TokenBuild(@NotNull @Valid PipelineUser user, @NotNull Map<String, Object> token) {
    }

    // api keys

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ApiKeyBeforeCreate(@NotNull String userId, String name, List<String> permissions) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ApiKeyAfterCreate(@NotNull @Valid PipelineApiKey apikey, @NotNull String userId) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ApiKeyBeforeExchange(@NotNull @Valid PipelineApiKey apikey, @NotNull @Valid RequestInfo request) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ApiKeyAfterExchange(@NotNull @Valid PipelineApiKey apikey) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ApiKeyBeforeRevoke(@NotNull @Valid PipelineApiKey apikey) {
    }

    // oauth clients

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ClientBeforeRegister(@NotNull String name,
                                       @NotNull List<String> redirectUrls,
                                       @Pattern(regexp = "public|confidential") String type) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ClientAfterRegister(@NotNull @Valid OAuthClient client) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ClientBeforeAuthorize(@NotNull @Valid PipelineUser user,
                                        @NotNull @Valid OAuthClient client,
                                        @NotNull List<String> scopes) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ClientAfterAuthorize(@NotNull @Valid PipelineUser user,
                                       @NotNull @Valid OAuthClient client,
                                       @NotNull @Valid ConsentGrant grant) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ClientAccessChange(@NotNull @Valid PipelineUser user,
                                     @NotNull @Valid OAuthClient client,
                                     @NotNull @Pattern(regexp = "grant|revoke") String action) {
    }
}
