package com.e2eq.amper.iam;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Size limits a composed bundle must respect. Defaults follow the cloud provider's published quotas.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PolicyLimits {

    // UTF-8 bytes of one managed policy document
    @Builder.Default
    private int maxManagedPolicySize = 6144;

    // UTF-8 bytes of a role's inline permissions policy
    @Builder.Default
    private int maxRolePolicySize = 10240;

    // UTF-8 bytes of a role trust policy
    @Builder.Default
    private int maxAssumeRolePolicySize = 2048;

    public static PolicyLimits defaults() {
        return PolicyLimits.builder().build();
    }
}
