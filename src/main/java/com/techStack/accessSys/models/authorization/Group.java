package com.techStack.accessSys.models.authorization;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Group {

    String id;
    String tenantId;
    String name;
    String parentGroupId;

    @Builder.Default
    boolean active = true;

    @Singular
    List<Assignment> roleGrants;
}
