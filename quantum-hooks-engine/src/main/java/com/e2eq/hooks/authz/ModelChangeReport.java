package com.e2eq.hooks.authz;

import java.util.List;

/**
 * Outcome of validating a proposed model change. Errors block the write; warnings
 * (such as removed permissions) do not.
 */
public record ModelChangeReport(List<String> errors, List<String> warnings) {

    public boolean valid() {
        return errors.isEmpty();
    }
}
