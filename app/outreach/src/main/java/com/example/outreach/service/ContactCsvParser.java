/*
 * Where: Outreach service layer
 * What: parses uploaded contact lists into contacts
 * Why: CSV exports from CRMs are the usual input to a generation job
 */
package com.example.outreach.service;

import com.example.outreach.model.Contact;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class ContactCsvParser {

  static final String COLUMN_EMAIL = "email";
  static final String COLUMN_FIRST_NAME = "first name";
  static final String COLUMN_LAST_NAME = "last name";
  static final String COLUMN_COMPANY = "company";
  static final String COLUMN_TITLE = "title";
  static final String COLUMN_WEBSITE = "website";
  static final String COLUMN_INDUSTRY = "industry";

  /**
   * Reads a header row followed by one contact per row. Header names are matched
   * case-insensitively; only the email column is required. Blank rows are ignored.
   */
  public List<Contact> parse(InputStream input) {
    final List<List<String>> rows = readRows(input);
    if (rows.isEmpty()) {
      throw new IllegalArgumentException("csv file is empty");
    }
    final Map<String, Integer> header = new HashMap<>();
    final List<String> names = rows.get(0);
    for (int i = 0; i < names.size(); i++) {
      header.putIfAbsent(names.get(i).replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT), i);
    }
    if (!header.containsKey(COLUMN_EMAIL)) {
      throw new IllegalArgumentException("csv header must contain an Email column");
    }
    final List<Contact> contacts = new ArrayList<>();
    for (List<String> row : rows.subList(1, rows.size())) {
      if (row.stream().allMatch(String::isBlank)) {
        continue;
      }
      contacts.add(
          new Contact(
              cell(row, header, COLUMN_EMAIL),
              cell(row, header, COLUMN_FIRST_NAME),
              cell(row, header, COLUMN_LAST_NAME),
              cell(row, header, COLUMN_COMPANY),
              cell(row, header, COLUMN_TITLE),
              cell(row, header, COLUMN_WEBSITE),
              cell(row, header, COLUMN_INDUSTRY)));
    }
    return contacts;
  }

  private String cell(List<String> row, Map<String, Integer> header, String column) {
    final Integer index = header.get(column);
    if (index == null || index >= row.size()) {
      return null;
    }
    final String value = row.get(index).trim();
    return value.isEmpty() ? null : value;
  }

  private List<List<String>> readRows(InputStream input) {
    final StringBuilder content = new StringBuilder();
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
      final char[] buffer = new char[8192];
      int read;
      while ((read = reader.read(buffer)) != -1) {
        content.append(buffer, 0, read);
      }
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to read csv upload", ex);
    }
    return split(content);
  }

  /** RFC 4180 style split: quoted fields may hold commas, newlines and doubled quotes. */
  private List<List<String>> split(CharSequence content) {
    final List<List<String>> rows = new ArrayList<>();
    List<String> row = new ArrayList<>();
    final StringBuilder field = new StringBuilder();
    boolean quoted = false;
    for (int i = 0; i < content.length(); i++) {
      final char c = content.charAt(i);
      if (quoted) {
        if (c == '"') {
          if (i + 1 < content.length() && content.charAt(i + 1) == '"') {
            field.append('"');
            i++;
          } else {
            quoted = false;
          }
        } else {
          field.append(c);
        }
        continue;
      }
      switch (c) {
        case '"' -> quoted = true;
        case ',' -> {
          row.add(field.toString());
          field.setLength(0);
        }
        case '\r' -> {
          // rows end at \n
        }
        case '\n' -> {
          row.add(field.toString());
          field.setLength(0);
          rows.add(row);
          row = new ArrayList<>();
        }
        default -> field.append(c);
      }
    }
    if (quoted) {
      throw new IllegalArgumentException("csv has an unterminated quoted field");
    }
    if (field.length() > 0 || !row.isEmpty()) {
      row.add(field.toString());
      rows.add(row);
    }
    return rows;
  }
}
