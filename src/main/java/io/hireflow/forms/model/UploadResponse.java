package io.hireflow.forms.model;

public record UploadResponse(String fileUrl, String filename, long size) {
}
