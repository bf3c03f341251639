package com.e2eq.amper.iam;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Effect {
   ALLOW ("Allow"),
   DENY ("Deny");

   final String value;

   Effect(String v)  {
      value = v;
   }

   @JsonValue
   public String value () {
      return value;
   }

   @JsonCreator
   public static Effect fromValue (String v) {
      for (Effect e : values()) {
         if (e.value.equalsIgnoreCase(v)) {
            return e;
         }
      }
      throw new IllegalArgumentException("Unknown policy statement effect '" + v + "'");
   }
}
