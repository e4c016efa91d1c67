package com.activelearn.versioning;

public final class BundleKeys {
    public static final String BUNDLE_PREFIX = "bundle.";
    public static final String APPROVAL_PREFIX = "approval.";
    static final String ACTIVE = "active";
    static final String CANARY = "canary";
    static final String BACKUP = "backup";
    static final String HISTORY = "history";

    private BundleKeys() {
    }

    public static String bundle(String agent, String bundleId) {
        return BUNDLE_PREFIX + agent + "." + bundleId;
    }

    public static String active(String agent) {
        return BUNDLE_PREFIX + agent + "." + ACTIVE;
    }

    public static String canary(String agent) {
        return BUNDLE_PREFIX + agent + "." + CANARY;
    }

    public static String backup(String agent) {
        return BUNDLE_PREFIX + agent + "." + BACKUP;
    }

    public static String history(String agent) {
        return BUNDLE_PREFIX + agent + "." + HISTORY;
    }

    public static String state(String agent, String bundleId) {
        return "bundle_state." + agent + "." + bundleId;
    }

    public static String sequence(String agent) {
        return "bundle_seq." + agent;
    }

    public static String approval(String approvalId) {
        return APPROVAL_PREFIX + approvalId;
    }

    static String agentOfCanaryKey(String key) {
        String suffix = "." + CANARY;
        if (!key.startsWith(BUNDLE_PREFIX) || !key.endsWith(suffix)) {
            return null;
        }
        return key.substring(BUNDLE_PREFIX.length(), key.length() - suffix.length());
    }
}
