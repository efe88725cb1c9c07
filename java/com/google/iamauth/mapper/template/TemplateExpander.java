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

package com.google.iamauth.mapper.template;

import static com.google.iamauth.mapper.model.ErrorReason.SESSION_NAME_NOT_APPLICABLE;
import static com.google.iamauth.mapper.model.ErrorReason.UNKNOWN_TEMPLATE_TOKEN;

import com.google.common.collect.ImmutableList;
import com.google.iamauth.mapper.arn.MatchFields;
import com.google.iamauth.mapper.model.MappingKind;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {{AccountID}}} and {@code {{SessionName}}} in username and group patterns.
 *
 * <p>Expansion is one left to right pass. Substituted values are never scanned again, so a session
 * name containing braces is copied literally.
 */
public final class TemplateExpander {

  public static final String ACCOUNT_ID = "AccountID";
  public static final String SESSION_NAME = "SessionName";

  private static final Pattern TOKEN = Pattern.compile("\\{\\{([^{}]*)\\}\\}");

  private TemplateExpander() {}

  /**
   * Expands a single pattern.
   *
   * @throws UnresolvedTemplateException if the pattern uses an unknown token, or uses {@code
   *     {{SessionName}}} while {@code fields} is not a role or has no session name
   */
  public static String expand(String pattern, MatchFields fields)
      throws UnresolvedTemplateException {
    Matcher matcher = TOKEN.matcher(pattern);
    StringBuilder result = new StringBuilder(pattern.length());
    int last = 0;
    while (matcher.find()) {
      result.append(pattern, last, matcher.start());
      result.append(valueOf(pattern, matcher.group(), matcher.group(1), fields));
      last = matcher.end();
    }
    result.append(pattern, last, pattern.length());
    return result.toString();
  }

  /** Expands every group pattern. Fails as a whole if any single group fails. */
  public static ImmutableList<String> expandAll(List<String> patterns, MatchFields fields)
      throws UnresolvedTemplateException {
    ImmutableList.Builder<String> expanded = ImmutableList.builderWithExpectedSize(patterns.size());
    for (String pattern : patterns) {
      expanded.add(expand(pattern, fields));
    }
    return expanded.build();
  }

  /**
   * Checks at load time that a pattern only uses tokens that can be resolved for principals of
   * {@code kind}.
   */
  public static void validate(String pattern, MappingKind kind) throws UnresolvedTemplateException {
    Matcher matcher = TOKEN.matcher(pattern);
    while (matcher.find()) {
      String name = matcher.group(1);
      if (SESSION_NAME.equals(name) && !kind.hasSession()) {
        throw new UnresolvedTemplateException(
            String.format(
                "Pattern '%s' uses %s, which is not available for %s mappings.",
                pattern, matcher.group(), kind.getResourceType()),
            SESSION_NAME_NOT_APPLICABLE,
            matcher.group());
      }
      if (!ACCOUNT_ID.equals(name) && !SESSION_NAME.equals(name)) {
        throw unknownToken(pattern, matcher.group());
      }
    }
  }

  private static String valueOf(String pattern, String token, String name, MatchFields fields)
      throws UnresolvedTemplateException {
    switch (name) {
      case ACCOUNT_ID:
        return fields.accountId();
      case SESSION_NAME:
        if (!MappingKind.ROLE.getResourceType().equals(fields.resourceType())) {
          throw new UnresolvedTemplateException(
              String.format(
                  "%s is not available for %s %s.",
                  token, fields.resourceType(), fields.resourceId()),
              SESSION_NAME_NOT_APPLICABLE,
              token);
        }
        Optional<String> sessionName = fields.sessionName();
        if (sessionName.isEmpty() || sessionName.get().isEmpty()) {
          throw new UnresolvedTemplateException(
              String.format(
                  "No session name is available for %s %s.",
                  fields.resourceType(), fields.resourceId()),
              SESSION_NAME_NOT_APPLICABLE,
              token);
        }
        return sessionName.get();
      default:
        throw unknownToken(pattern, token);
    }
  }

  private static UnresolvedTemplateException unknownToken(String pattern, String token) {
    return new UnresolvedTemplateException(
        String.format(
            "Pattern '%s' uses unknown template token %s; only {{%s}} and {{%s}} are supported.",
            pattern, token, ACCOUNT_ID, SESSION_NAME),
        UNKNOWN_TEMPLATE_TOKEN,
        token);
  }
}
