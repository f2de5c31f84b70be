package io.otlite.server.dto;

/** JSON body for PUT /docs/{id}: { "content": "initial text" }. content may be omitted. */
public class OpenRequest {
    public String content;
}
