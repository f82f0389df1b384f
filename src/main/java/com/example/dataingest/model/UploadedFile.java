package com.example.dataingest.model;

public record UploadedFile(String filename, long size, String path) {
}
