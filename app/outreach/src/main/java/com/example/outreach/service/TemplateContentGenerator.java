/*
 * Where: Outreach service layer
 * What: renders template placeholders with contact and sender fields
 * Why: local stand-in for the external content generator
 */
package com.example.outreach.service;

import com.example.outreach.model.Contact;
import com.example.outreach.model.EmailStage;
import com.example.outreach.model.EmailTemplate;
import com.example.outreach.model.GeneratedContent;
import com.example.outreach.model.OwnerProfile;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class TemplateContentGenerator implements ContentGenerator {

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([a-z_]+)\\s*}}");

  @Override
  public GeneratedContent generate(
      Contact contact, OwnerProfile owner, EmailTemplate template, EmailStage stage) {
    if (template == null) {
      throw new ContentGenerationException("no template for stage " + stage.value());
    }
    if (template.category() != stage) {
      throw new ContentGenerationException(
          "template category " + template.category().category() + " does not match stage "
              + stage.value());
    }
    final Map<String, String> values = placeholders(contact, owner);
    final String subject = render(template.subject(), values);
    final String body = render(template.body(), values);
    if (subject.isBlank() || body.isBlank()) {
      throw new ContentGenerationException("rendered content is empty");
    }
    return new GeneratedContent(subject, body);
  }

  private Map<String, String> placeholders(Contact contact, OwnerProfile owner) {
    final Map<String, String> values = new LinkedHashMap<>();
    values.put("first_name", orEmpty(contact.firstName()));
    values.put("last_name", orEmpty(contact.lastName()));
    values.put("recipient_name", contact.recipientName());
    values.put("company", orEmpty(contact.company()));
    values.put("title", orEmpty(contact.title()));
    values.put("sender_name", orEmpty(owner.fullName()));
    values.put("sender_position", orEmpty(owner.position()));
    values.put("sender_company", orEmpty(owner.companyName()));
    values.put("sender_contact", orEmpty(owner.contactInfo()));
    return values;
  }

  private String render(String text, Map<String, String> values) {
    if (text == null) {
      return "";
    }
    final Matcher matcher = PLACEHOLDER.matcher(text);
    final StringBuilder rendered = new StringBuilder();
    while (matcher.find()) {
      // Unknown placeholders are left as written.
      final String replacement = values.getOrDefault(matcher.group(1), matcher.group());
      matcher.appendReplacement(rendered, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(rendered);
    return rendered.toString().trim();
  }

  private String orEmpty(String value) {
    return value == null ? "" : value.trim();
  }
}
