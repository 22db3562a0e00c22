package com.openrangelabs.donpetre.mlssync.model;

/**
 * Upstream MLS protocol families. Each family has its own login flow,
 * search endpoint and payload schema.
 */
public enum ProviderFamily {
    RETS,   // session-cookie login, flat field names
    RESO,   // OAuth client credentials, RESO Web API (OData)
    CUSTOM  // JSON login, snake_case payloads
}
