package com.techStack.accessSys.models.graph;

import com.techStack.accessSys.models.authorization.Group;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class GroupGraph {

    @Singular
    Map<String, Group> groups;

    public static GroupGraph empty() {
        return GroupGraph.builder().build();
    }

    public String parentOf(String groupId) {
        Group group = groups.get(groupId);
        return group == null ? null : group.getParentGroupId();
    }
}
