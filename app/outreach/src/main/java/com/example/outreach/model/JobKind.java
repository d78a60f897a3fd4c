package com.example.outreach.model;

public enum JobKind {
  GENERATE,
  SEND
}
