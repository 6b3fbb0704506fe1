package com.acme.resume.ingest.upload.exchange;

/**
 * @param content base64 of the original file bytes
 */
public record AgentFile(String name, String type, String content) {
}
