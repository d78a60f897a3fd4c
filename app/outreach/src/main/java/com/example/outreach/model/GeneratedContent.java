package com.example.outreach.model;

public record GeneratedContent(String subject, String body) {}
