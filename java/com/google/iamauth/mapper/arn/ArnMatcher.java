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

import java.util.Optional;

/**
 * Decides whether a configured role or user ARN matches a caller ARN.
 *
 * <p>Partition, account ID, resource type and name must be equal, case-sensitively. The IAM path
 * is ignored, so {@code role/Foo} matches {@code role/team/Foo}. There is no other wildcarding.
 * Malformed ARNs never match.
 *
 * <p>The partition of a configured ARN always overrides the configured default partition, so a
 * mapping for {@code arn:aws-cn:...} matches callers in {@code aws-cn} only.
 */
public final class ArnMatcher {

  private ArnMatcher() {}

  /**
   * Matches a configured ARN against a caller ARN.
   *
   * @return the fields extracted from the caller, or empty if either ARN is malformed or they do
   *     not match
   */
  public static Optional<MatchFields> match(String pattern, String candidate) {
    Optional<PrincipalArn> parsedPattern = PrincipalArn.parse(pattern);
    Optional<PrincipalArn> parsedCandidate = PrincipalArn.parse(candidate);
    if (parsedPattern.isEmpty() || parsedCandidate.isEmpty()) {
      return Optional.empty();
    }
    return match(parsedPattern.get(), parsedCandidate.get());
  }

  /** Matches two parsed ARNs. A pattern in assumed-role form never matches. */
  public static Optional<MatchFields> match(PrincipalArn pattern, PrincipalArn candidate) {
    if (pattern.isAssumedRole()
        || !pattern.partition().equals(candidate.partition())
        || !pattern.accountId().equals(candidate.accountId())
        || pattern.kind() != candidate.kind()
        || !pattern.name().equals(candidate.name())) {
      return Optional.empty();
    }
    return Optional.of(fieldsOf(candidate, pattern.path().equals(candidate.path())));
  }

  /** Extracts the template fields of a caller ARN. */
  public static MatchFields fieldsOf(PrincipalArn candidate, boolean exactPath) {
    return MatchFields.builder()
        .setPartition(candidate.partition())
        .setAccountId(candidate.accountId())
        .setResourceType(candidate.kind().getResourceType())
        .setResourceId(candidate.name())
        .setPath(candidate.path())
        .setSessionName(candidate.sessionName())
        .setExactPath(exactPath)
        .build();
  }
}
