package com.e2eq.hooks.exceptions;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ValidationException;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Hook payload did not match the hook's input contract. No script was executed.
 */
public class HookInputValidationException extends ValidationException {
   private static final long serialVersionUID = 1L;

   protected final String hookName;
   protected final transient Set<ConstraintViolation<Object>> violationSet;

   public HookInputValidationException(String hookName, Set<ConstraintViolation<Object>> violationSet) {
      super();
      this.hookName = hookName;
      this.violationSet = violationSet == null ? Collections.emptySet() : violationSet;
   }

   public HookInputValidationException(String hookName, String message, Throwable cause) {
      super(message, cause);
      this.hookName = hookName;
      this.violationSet = Collections.emptySet();
   }

   public String getHookName() {
      return hookName;
   }

   public Set<ConstraintViolation<Object>> getViolationSet() {
      return violationSet;
   }

   /**
    * Violations rendered as {@code path: message}, sorted for stable output.
    */
   public List<String> getViolationMessages() {
      return violationSet.stream()
              .map(v -> v.getPropertyPath() + ": " + v.getMessage())
              .sorted()
              .collect(Collectors.toList());
   }

   @Override
   public String getMessage() {
      if (!violationSet.isEmpty()) {
         return "Invalid input for hook " + hookName + ": " + String.join("; ", getViolationMessages());
      }
      return super.getMessage();
   }
}
