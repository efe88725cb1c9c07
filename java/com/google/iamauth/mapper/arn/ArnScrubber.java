/*
 * Copyright 2022 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.iamauth.mapper.arn;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableSet;
import com.google.iamauth.mapper.config.Annotations.ScrubbedAccounts;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.inject.Inject;
import javax.inject.Singleton;
import software.amazon.awssdk.arns.Arn;

/**
 * Redacts ARNs that belong to scrubbed accounts. Only for log and metric call sites; values
 * returned to callers are never scrubbed.
 */
@Singleton
public final class ArnScrubber {

  private static final CharMatcher RESOURCE_DELIMITER = CharMatcher.anyOf("/:");
  private static final Pattern ARN_IN_TEXT = Pattern.compile("arn:[^\\s'\"]+");

  private final ImmutableSet<String> scrubbedAccounts;

  @Inject
  public ArnScrubber(@ScrubbedAccounts ImmutableSet<String> scrubbedAccounts) {
    this.scrubbedAccounts = scrubbedAccounts;
  }

  /** Scrubs with the accounts this instance was created with. */
  public String scrub(String arn) {
    return scrub(arn, scrubbedAccounts);
  }

  /** Scrubs every ARN embedded in a free text message, such as an exception message. */
  public String scrubText(String text) {
    if (text == null || scrubbedAccounts.isEmpty()) {
      return text;
    }
    Matcher matcher = ARN_IN_TEXT.matcher(text);
    StringBuilder result = new StringBuilder(text.length());
    while (matcher.find()) {
      matcher.appendReplacement(
          result, Matcher.quoteReplacement(scrub(matcher.group(), scrubbedAccounts)));
    }
    matcher.appendTail(result);
    return result.toString();
  }

  /**
   * Returns {@code arn:***:<resource-type>/***} if the account of {@code arn} is in {@code
   * scrubbedAccounts}, otherwise {@code arn} unchanged. Input that is not an ARN is returned
   * unchanged, which makes the redacted form a fixed point.
   */
  public static String scrub(String arn, Set<String> scrubbedAccounts) {
    if (arn == null || scrubbedAccounts.isEmpty()) {
      return arn;
    }
    Arn parsed;
    try {
      parsed = Arn.fromString(arn);
    } catch (IllegalArgumentException e) {
      return arn;
    }
    Optional<String> accountId = parsed.accountId();
    if (accountId.isEmpty() || !scrubbedAccounts.contains(accountId.get())) {
      return arn;
    }
    String resource = parsed.resourceAsString();
    int typeEnd = RESOURCE_DELIMITER.indexIn(resource);
    String resourceType = typeEnd < 0 ? resource : resource.substring(0, typeEnd);
    return "arn:***:" + resourceType + "/***";
  }
}
