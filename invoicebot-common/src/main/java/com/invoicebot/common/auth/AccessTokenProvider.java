package com.invoicebot.common.auth;

/**
 * Source of bearer tokens for Microsoft Graph.
 *
 * {@link #getToken()} may be called before every request and is expected to be
 * cheap after the first call. {@link #refreshToken()} discards the cached token
 * and fetches a new one; callers use it once after an HTTP 401.
 */
public interface AccessTokenProvider {

    String getToken();

    String refreshToken();
}
