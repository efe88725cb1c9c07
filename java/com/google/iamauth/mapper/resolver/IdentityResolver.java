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

package com.google.iamauth.mapper.resolver;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.iamauth.mapper.arn.ArnMatcher;
import com.google.iamauth.mapper.arn.ArnScrubber;
import com.google.iamauth.mapper.arn.MatchFields;
import com.google.iamauth.mapper.arn.PrincipalArn;
import com.google.iamauth.mapper.index.MappingIndex;
import com.google.iamauth.mapper.index.ResolvedMapping;
import com.google.iamauth.mapper.merge.MappingIndexHolder;
import com.google.iamauth.mapper.model.PlatformIdentity;
import com.google.iamauth.mapper.model.ResolutionResult;
import com.google.iamauth.mapper.template.TemplateExpander;
import com.google.iamauth.mapper.template.UnresolvedTemplateException;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a verified caller ARN to a Kubernetes identity using the currently published mapping
 * index.
 *
 * <p>Resolution never throws. Anything that does not end in a fully expanded mapping is reported
 * as {@link ResolutionResult.Outcome#DENIED} or {@link ResolutionResult.Outcome#MALFORMED}, both of
 * which must be treated as unauthenticated.
 */
@Singleton
public final class IdentityResolver {

  private static final Logger logger = LoggerFactory.getLogger(IdentityResolver.class);

  private final MappingIndexHolder indexHolder;
  private final ArnScrubber scrubber;

  @Inject
  public IdentityResolver(MappingIndexHolder indexHolder, ArnScrubber scrubber) {
    this.indexHolder = indexHolder;
    this.scrubber = scrubber;
  }

  /**
   * Resolves a caller.
   *
   * @param candidateArn the caller ARN returned by the credential verifier, either an IAM role or
   *     user ARN or an STS assumed-role ARN
   * @param accountId the caller's account as reported by the verifier; if null or empty the
   *     account of {@code candidateArn} is used
   * @param sessionName the caller's session name as reported by the verifier; if null or empty the
   *     session of an assumed-role {@code candidateArn} is used
   */
  public ResolutionResult resolve(String candidateArn, String accountId, String sessionName) {
    Optional<PrincipalArn> parsed = PrincipalArn.parse(candidateArn);
    if (parsed.isEmpty()) {
      logger.info("Rejecting unparseable caller ARN '{}'", scrubber.scrubText(candidateArn));
      return ResolutionResult.malformed(
          String.format("'%s' is not an IAM role, IAM user or assumed-role ARN", candidateArn));
    }
    PrincipalArn candidate = parsed.get();

    // Take the snapshot once; a concurrent reload does not affect this resolution.
    Optional<MappingIndex> index = indexHolder.current();
    if (index.isEmpty()) {
      logger.warn("No mapping index has been published yet, denying {}", scrub(candidate));
      return ResolutionResult.denied("No mappings are loaded yet");
    }
    Optional<ResolvedMapping> rule = index.get().lookup(candidate);
    if (rule.isEmpty()) {
      logger.info("No mapping found for {}", scrub(candidate));
      return ResolutionResult.denied(
          String.format("No mapping found for %s", candidate.canonical()));
    }
    return expand(candidate, rule.get(), accountId, sessionName);
  }

  private ResolutionResult expand(
      PrincipalArn candidate, ResolvedMapping rule, String accountId, String sessionName) {
    String effectiveAccountId =
        Strings.isNullOrEmpty(accountId) ? candidate.accountId() : accountId;
    Optional<String> effectiveSessionName =
        Strings.isNullOrEmpty(sessionName) ? candidate.sessionName() : Optional.of(sessionName);
    PlatformIdentity.Builder identity =
        PlatformIdentity.builder()
            .setArn(candidate.canonical())
            .setAccountId(effectiveAccountId)
            .setSessionName(effectiveSessionName);

    if (rule.autoMapped()) {
      logger.debug("Account of {} is auto-mapped", scrub(candidate));
      return ResolutionResult.allowed(
          identity.setUsername(rule.username()).setGroups(ImmutableList.of()).build(), rule.arn());
    }

    MatchFields fields =
        ArnMatcher.fieldsOf(candidate, rule.pattern().path().equals(candidate.path()))
            .toBuilder()
            .setAccountId(effectiveAccountId)
            .setSessionName(effectiveSessionName)
            .build();
    try {
      String username = TemplateExpander.expand(rule.username(), fields);
      ImmutableList<String> groups = TemplateExpander.expandAll(rule.groups(), fields);
      logger.debug(
          "Mapped {} to '{}' using {} mapping {}",
          scrub(candidate),
          username,
          rule.backend(),
          scrubber.scrub(rule.arn()));
      return ResolutionResult.allowed(
          identity.setUsername(username).setGroups(groups).build(), rule.arn());
    } catch (UnresolvedTemplateException e) {
      logger.error(
          "Mapping {} from backend {} could not be expanded for {}: {}",
          scrubber.scrub(rule.arn()),
          rule.backend(),
          scrub(candidate),
          e.toString());
      return ResolutionResult.malformed(rule.arn(), e.getMessage());
    }
  }

  private String scrub(PrincipalArn candidate) {
    return scrubber.scrub(candidate.raw());
  }
}
