package com.techStack.accessSys.config;

import com.techStack.accessSys.models.tenant.CapabilityCeiling;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Getter
@Setter
@ConfigurationProperties(prefix = "access.engine")
public class EngineProperties {

    /** Deadline applied to every evaluation, batch included. */
    private Duration evaluationTimeout = Duration.ofMillis(250);

    /** Re-check the principal's tenant ceiling while evaluating. */
    private boolean ceilingRecheck = false;

    /** Let roles attached to ancestor groups of a direct group apply as well. */
    private boolean inheritGroupRoles = false;

    /** Resource type and action that grant cross-branch visibility, as {@code type:action}. */
    private String crossBranchCapability = "branch:cross_branch_read";

    /** Product-level ceiling for root tenants; empty means unrestricted. */
    private Map<String, List<String>> productCatalog = new HashMap<>();

    private Cache cache = new Cache();

    @Getter
    @Setter
    public static class Cache {
        public enum Backend { LOCAL, REDIS }

        private Backend backend = Backend.LOCAL;
        private Duration ttl = Duration.ofMinutes(5);
        private long maxSize = 10_000;
        private String keyPrefix = "accessSys:decision:";
    }

    public CapabilityCeiling productCeiling() {
        return CapabilityCeiling.of(productCatalog);
    }

    public String crossBranchResourceType() {
        return splitCapability()[0];
    }

    public String crossBranchAction() {
        return splitCapability()[1].toLowerCase(Locale.ROOT);
    }

    private String[] splitCapability() {
        int idx = crossBranchCapability == null ? -1 : crossBranchCapability.lastIndexOf(':');
        if (idx <= 0 || idx == crossBranchCapability.length() - 1) {
            throw new IllegalStateException(
                    "access.engine.cross-branch-capability must look like <resourceType>:<action>, got "
                            + crossBranchCapability);
        }
        return new String[]{crossBranchCapability.substring(0, idx), crossBranchCapability.substring(idx + 1)};
    }
}
