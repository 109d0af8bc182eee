package com.stardust.core.domain;

/**
 * Caller details captured with every audited access.
 *
 * @param sourceAddress caller network address, may be null
 * @param userAgent caller agent string, may be null
 */
public record RequestContext(String sourceAddress, String userAgent) {

    public static final RequestContext NONE = new RequestContext(null, null);

    public static RequestContext of(String sourceAddress, String userAgent) {
        return new RequestContext(sourceAddress, userAgent);
    }
}
