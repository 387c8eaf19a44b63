package com.techStack.accessSys.service.authorization;

import com.techStack.accessSys.models.authorization.FieldLevel;
import com.techStack.accessSys.models.authorization.PermissionRecord;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Most-permissive merge of the field maps of the permissions that justified a grant:
 * write beats read beats hidden. Fields nobody mentions are left out.
 */
@Component
public class FieldPermissionMerger {

    public SortedMap<String, FieldLevel> merge(Collection<PermissionRecord> satisfied) {
        SortedMap<String, FieldLevel> merged = new TreeMap<>();
        for (PermissionRecord permission : satisfied) {
            if (permission.getFieldPermissions() == null) {
                continue;
            }
            permission.getFieldPermissions().forEach((field, level) ->
                    merged.merge(field, level, FieldLevel::mostPermissive));
        }
        return Collections.unmodifiableSortedMap(merged);
    }
}
