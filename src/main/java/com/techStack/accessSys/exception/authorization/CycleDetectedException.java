package com.techStack.accessSys.exception.authorization;

import com.techStack.accessSys.dto.response.ErrorCode;
import com.techStack.accessSys.exception.service.CustomException;
import com.techStack.accessSys.models.authorization.HierarchyKind;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * A hierarchy walk revisited a node.
 */
@Getter
public class CycleDetectedException extends CustomException {

    private final HierarchyKind kind;
    private final String startId;
    private final String repeatedId;

    public CycleDetectedException(HierarchyKind kind, String startId, String repeatedId) {
        super(HttpStatus.CONFLICT,
                String.format("Cycle detected in %s hierarchy: walking up from %s revisited %s",
                        kind.name().toLowerCase(), startId, repeatedId),
                "parentId", ErrorCode.CYCLE_DETECTED.getCode());
        this.kind = kind;
        this.startId = startId;
        this.repeatedId = repeatedId;
    }
}
