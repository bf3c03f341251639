package com.e2eq.amper.iam;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * An access policy document: a version and an ordered list of statements.
 * A document without statements is the placeholder emitted for a template that rendered nothing.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"Version", "Statement"})
public class IAMPolicyDoc {

   /** The only policy language version amper emits or accepts. */
   public static final String VERSION = "2012-10-17";

   @JsonProperty("Version")
   private String version;

   @JsonProperty("Statement")
   private List<IAMPolicyStatement> statements = new ArrayList<>();

   public static IAMPolicyDoc of(IAMPolicyStatement... statements) {
      return new IAMPolicyDoc(null, new ArrayList<>(List.of(statements)));
   }

   public static IAMPolicyDoc empty() {
      return new IAMPolicyDoc();
   }

   @JsonIgnore
   public boolean isEmpty() {
      return statements == null || statements.isEmpty();
   }
}
