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

import com.google.auto.value.AutoValue;
import com.google.common.base.Splitter;
import com.google.iamauth.mapper.model.MappingKind;
import java.util.List;
import java.util.Optional;
import software.amazon.awssdk.arns.Arn;

/**
 * An IAM role or user ARN, decomposed into the fields used for matching.
 *
 * <p>Accepted forms:
 *
 * <pre>
 *   arn:{partition}:iam::{account}:role/{name}
 *   arn:{partition}:iam::{account}:role/{path}/{name}
 *   arn:{partition}:iam::{account}:user/{name}
 *   arn:{partition}:iam::{account}:user/{path}/{name}
 *   arn:{partition}:sts::{account}:assumed-role/{name}/{session}
 * </pre>
 *
 * The STS form is canonicalized to the role it was assumed from, with the session name kept
 * separately. STS drops the role path, so an assumed-role ARN always has the root path.
 */
@AutoValue
public abstract class PrincipalArn {

  private static final String IAM_SERVICE = "iam";
  private static final String STS_SERVICE = "sts";
  private static final String ASSUMED_ROLE = "assumed-role";
  private static final String ROOT_PATH = "/";
  private static final Splitter SLASH = Splitter.on('/');

  /**
   * Parses an ARN. Returns empty for anything that is not a well formed IAM role, IAM user or STS
   * assumed-role ARN.
   */
  public static Optional<PrincipalArn> parse(String value) {
    if (value == null || value.isEmpty()) {
      return Optional.empty();
    }
    Arn arn;
    try {
      arn = Arn.fromString(value);
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
    Optional<String> accountId = arn.accountId();
    if (accountId.isEmpty()) {
      return Optional.empty();
    }
    String resource = arn.resourceAsString();
    switch (arn.service()) {
      case IAM_SERVICE:
        return parseIamResource(value, arn.partition(), accountId.get(), resource);
      case STS_SERVICE:
        return parseAssumedRole(value, arn.partition(), accountId.get(), resource);
      default:
        return Optional.empty();
    }
  }

  private static Optional<PrincipalArn> parseIamResource(
      String raw, String partition, String accountId, String resource) {
    int typeEnd = resource.indexOf('/');
    if (typeEnd <= 0) {
      return Optional.empty();
    }
    Optional<MappingKind> kind = kindOf(resource.substring(0, typeEnd));
    int nameStart = resource.lastIndexOf('/') + 1;
    if (kind.isEmpty() || nameStart == resource.length()) {
      return Optional.empty();
    }
    String path = resource.substring(typeEnd, nameStart);
    if (path.contains("//")) {
      return Optional.empty();
    }
    return Optional.of(
        new AutoValue_PrincipalArn(
            raw,
            partition,
            accountId,
            kind.get(),
            path,
            resource.substring(nameStart),
            Optional.empty()));
  }

  private static Optional<PrincipalArn> parseAssumedRole(
      String raw, String partition, String accountId, String resource) {
    List<String> parts = SLASH.splitToList(resource);
    if (parts.size() != 3
        || !ASSUMED_ROLE.equals(parts.get(0))
        || parts.get(1).isEmpty()
        || parts.get(2).isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(
        new AutoValue_PrincipalArn(
            raw,
            partition,
            accountId,
            MappingKind.ROLE,
            ROOT_PATH,
            parts.get(1),
            Optional.of(parts.get(2))));
  }

  private static Optional<MappingKind> kindOf(String resourceType) {
    for (MappingKind kind : MappingKind.values()) {
      if (kind.getResourceType().equals(resourceType)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }

  /** The ARN exactly as it was given. */
  public abstract String raw();

  public abstract String partition();

  public abstract String accountId();

  public abstract MappingKind kind();

  /** IAM path, beginning and ending with {@code /}. The root path is {@code /}. */
  public abstract String path();

  /** Role or user name, the last segment of the resource. */
  public abstract String name();

  /** Session name, present only for STS assumed-role ARNs. */
  public abstract Optional<String> sessionName();

  public boolean isAssumedRole() {
    return sessionName().isPresent();
  }

  /** The IAM form of this ARN, e.g. {@code arn:aws:iam::123456789012:role/path/Foo}. */
  public String canonical() {
    return String.format(
        "arn:%s:%s::%s:%s%s%s",
        partition(), IAM_SERVICE, accountId(), kind().getResourceType(), path(), name());
  }
}
