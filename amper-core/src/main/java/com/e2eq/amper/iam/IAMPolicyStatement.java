package com.e2eq.amper.iam;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One statement of an access policy document. Exactly one of {@code actions} and
 * {@code notActions} is expected to be populated. Single string values of
 * {@code Action}, {@code NotAction}, {@code Resource} and principal lists are accepted on read.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"Sid", "Effect", "Principal", "Action", "NotAction", "Resource", "Condition"})
public class IAMPolicyStatement {

   public static final String WILDCARD = "*";

   @JsonProperty("Sid")
   private String sid;

   @JsonProperty("Effect")
   private Effect effect;

   // e.g. {"Service": ["ec2.amazonaws.com"]}
   @JsonProperty("Principal")
   @Builder.Default
   private Map<String, List<String>> principal = new LinkedHashMap<>();

   @JsonProperty("Action")
   @Builder.Default
   private List<String> actions = new ArrayList<>();

   @JsonProperty("NotAction")
   @Builder.Default
   private List<String> notActions = new ArrayList<>();

   @JsonProperty("Resource")
   @Builder.Default
   private List<String> resources = new ArrayList<>();

   // operator -> condition key -> values
   @JsonProperty("Condition")
   @Builder.Default
   private Map<String, Map<String, Object>> condition = new LinkedHashMap<>();

   public static IAMPolicyStatement denyAll() {
      return IAMPolicyStatement.builder()
         .sid("DenyAll")
         .effect(Effect.DENY)
         .actions(new ArrayList<>(List.of(WILDCARD)))
         .resources(new ArrayList<>(List.of(WILDCARD)))
         .build();
   }

   /**
    * Deny every action not named in {@code scope}. The caller supplies the scope already ordered.
    */
   public static IAMPolicyStatement denyUnknownServices(List<String> scope) {
      return IAMPolicyStatement.builder()
         .sid("DenyUnknownServices")
         .effect(Effect.DENY)
         .notActions(new ArrayList<>(scope))
         .resources(new ArrayList<>(List.of(WILDCARD)))
         .build();
   }

   public static IAMPolicyStatement allowAll() {
      return IAMPolicyStatement.builder()
         .sid("AllowAll")
         .effect(Effect.ALLOW)
         .actions(new ArrayList<>(List.of(WILDCARD)))
         .resources(new ArrayList<>(List.of(WILDCARD)))
         .build();
   }
}
