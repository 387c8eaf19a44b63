package com.techStack.accessSys.models.graph;

import com.techStack.accessSys.models.authorization.Assignment;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Direct user→role and user→group edges of one principal, expired edges included.
 */
@Value
@Builder
public class PrincipalAssignments {

    String principalId;

    @Singular
    List<Assignment> roles;

    @Singular
    List<Assignment> groups;

    public static PrincipalAssignments none(String principalId) {
        return PrincipalAssignments.builder().principalId(principalId).build();
    }
}
