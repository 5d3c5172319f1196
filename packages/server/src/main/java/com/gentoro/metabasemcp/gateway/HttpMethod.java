package com.gentoro.metabasemcp.gateway;

/** Methods the core is allowed to issue through the {@link Gateway}. */
public enum HttpMethod {
  GET,
  POST,
  PUT
}
