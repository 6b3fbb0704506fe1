package com.acme.resume.ingest.upload;

/**
 * An upload that passed every precondition
 *
 * @param authorization value forwarded as is in the <code>Authorization</code> header of both pipelines
 */
public record ResumeSubmission(String fileName, String contentType, byte[] content, String userId, String authorization) {
}
