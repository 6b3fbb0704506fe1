package com.acme.resume.ingest.info;

import java.util.List;

public record ServiceIndex(String status, String message, List<String> routes) {
}
