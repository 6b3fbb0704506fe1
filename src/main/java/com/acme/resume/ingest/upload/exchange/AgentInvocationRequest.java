package com.acme.resume.ingest.upload.exchange;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

//{"query":"<>","user_id":"<>","request_id":"<uuid>","session_id":"<uuid>","files":[{"name":"<>","type":"<mime>","content":"<base64>"}]}
public record AgentInvocationRequest(@JsonProperty("query") String query,
                                     @JsonProperty("user_id") String userId,
                                     @JsonProperty("request_id") String requestId,
                                     @JsonProperty("session_id") String sessionId,
                                     @JsonProperty("files") List<AgentFile> files) {
}
