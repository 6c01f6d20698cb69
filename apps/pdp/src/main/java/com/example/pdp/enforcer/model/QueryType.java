package com.example.pdp.enforcer.model;

/**
 * Query shapes served by the router, with the engine document each one evaluates.
 */
public enum QueryType {
    ALLOWED("allowed", "permit/root"),
    BULK("allowed_bulk", "permit/bulk"),
    ALL_TENANTS("allowed_all_tenants", "permit/any_tenant"),
    URL("allowed_url", "permit/root"),
    USER_PERMISSIONS("user_permissions", "permit/user_permissions"),
    USER_TENANTS("user_tenants", "permit/user_permissions/tenants"),
    KONG("kong", "permit/root");

    private final String tag;
    private final String enginePath;

    QueryType(String tag, String enginePath) {
        this.tag = tag;
        this.enginePath = enginePath;
    }

    /**
     * Bounded value used in metrics and logs.
     */
    public String tag() {
        return tag;
    }

    public String enginePath() {
        return enginePath;
    }

    public String cachePrefix() {
        return "pdp:" + tag;
    }
}
