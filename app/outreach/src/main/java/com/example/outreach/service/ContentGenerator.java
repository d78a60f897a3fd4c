package com.example.outreach.service;

import com.example.outreach.model.Contact;
import com.example.outreach.model.EmailStage;
import com.example.outreach.model.EmailTemplate;
import com.example.outreach.model.GeneratedContent;
import com.example.outreach.model.OwnerProfile;

/** Produces the subject and body of one email. Throws {@link ContentGenerationException}. */
public interface ContentGenerator {
  GeneratedContent generate(
      Contact contact, OwnerProfile owner, EmailTemplate template, EmailStage stage);
}
