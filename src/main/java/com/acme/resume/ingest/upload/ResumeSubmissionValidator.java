package com.acme.resume.ingest.upload;

import com.acme.resume.ingest.common.ResumeIngestProperties;
import com.acme.resume.ingest.util.MiscUtil;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.http.codec.multipart.FormFieldPart;
import org.springframework.http.codec.multipart.Part;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import reactor.core.publisher.Mono;

import java.util.Set;

import static org.springframework.http.HttpHeaders.CONTENT_TYPE;
import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.UNAUTHORIZED;
import static org.springframework.util.StringUtils.hasText;

/**
 * Checks, in order: file present, credential present, file type, file size. The first failing check decides the response
 */
@Log4j2
@Component
public class ResumeSubmissionValidator {

  static final String FILE_PART = "file";
  static final String API_KEY_PART = "api_key";
  static final String USER_ID_PART = "user_id";
  static final String INVALID_TYPE_MESSAGE = "Invalid file type. Please upload PDF or Word documents only.";

  private static final Set<String> ALLOWED_TYPES = Set.of(
      "application/pdf",
      "application/msword",
      "application/vnd.openxmlformats-officedocument.wordprocessingml.document");

  private final ResumeIngestProperties properties;

  public ResumeSubmissionValidator(ResumeIngestProperties properties) {
    this.properties = properties;
  }

  public Mono<ResumeSubmission> validate(MultiValueMap<String, Part> parts, @Nullable String authorizationHeader) {
    final var filePart = parts.getFirst(FILE_PART);
    if (!(filePart instanceof FilePart)) {
      return Mono.error(new ResumeRejectedException(BAD_REQUEST, "No file provided"));
    }
    final var file = (FilePart) filePart;

    final var authorization = resolveAuthorization(authorizationHeader, formValue(parts, API_KEY_PART));
    if (authorization == null) {
      return Mono.error(new ResumeRejectedException(UNAUTHORIZED, "Unauthorized - Please provide your API key or login"));
    }

    final var contentType = allowedContentType(file);
    if (contentType == null) {
      return Mono.error(new ResumeRejectedException(BAD_REQUEST, INVALID_TYPE_MESSAGE));
    }

    final var maxFileSize = properties.maxFileSize();
    final var tooLarge = new ResumeRejectedException(BAD_REQUEST, "File size exceeds the " + maxFileSize.toMegabytes() + "MB limit");
    final var userId = formValue(parts, USER_ID_PART);

    return MiscUtil.readAllBytes(file.content(), Math.toIntExact(maxFileSize.toBytes()))
        .onErrorMap(DataBufferLimitException.class, __ -> tooLarge)
        .map(content -> new ResumeSubmission(
            file.filename(),
            new MediaType(contentType.getType(), contentType.getSubtype()).toString(),
            content,
            hasText(userId) ? userId : properties.defaultUserId(),
            authorization));
  }

  /**
   * Header wins over api key. Api key is forwarded as a bearer token
   */
  @Nullable
  static String resolveAuthorization(@Nullable String authorizationHeader, @Nullable String apiKey) {
    if (hasText(authorizationHeader)) {
      return authorizationHeader;
    }
    if (hasText(apiKey)) {
      return "Bearer " + apiKey;
    }
    return null;
  }

  /**
   * @return declared type of the file without parameters, or <code>null</code> when it is missing, unparseable or not
   * one we accept
   */
  @Nullable
  private static MediaType allowedContentType(FilePart file) {
    final var declaredType = file.headers().getFirst(CONTENT_TYPE);
    if (!hasText(declaredType)) {
      log.debug("Rejecting {} without a content type", file.filename());
      return null;
    }
    final MediaType contentType;
    try {
      contentType = MediaType.parseMediaType(declaredType);
    } catch (InvalidMediaTypeException e) {
      log.debug("Rejecting {} with unparseable content type {}", file.filename(), declaredType);
      return null;
    }
    if (!ALLOWED_TYPES.contains(contentType.getType() + "/" + contentType.getSubtype())) {
      log.debug("Rejecting {} with content type {}", file.filename(), contentType);
      return null;
    }
    return contentType;
  }

  @Nullable
  private static String formValue(MultiValueMap<String, Part> parts, String name) {
    final var part = parts.getFirst(name);
    return part instanceof FormFieldPart ? ((FormFieldPart) part).value() : null;
  }
}
