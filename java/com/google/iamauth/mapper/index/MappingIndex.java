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

package com.google.iamauth.mapper.index;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.iamauth.mapper.arn.PrincipalArn;
import com.google.iamauth.mapper.backend.BackendMode;
import com.google.iamauth.mapper.model.MappingKind;
import com.google.iamauth.mapper.model.RoleMapping;
import com.google.iamauth.mapper.model.UserMapping;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup structure over role mappings, user mappings and auto-mapped accounts.
 *
 * <p>Role and user rules are kept apart and keyed by partition, account and name, ignoring the IAM
 * path. When several rules share a key, a rule whose path equals the caller's path wins; otherwise
 * the first declared rule wins. An index is never modified after {@link Builder#build()}, so it can
 * be read concurrently without locking.
 */
public final class MappingIndex {

  private final String partitionId;
  private final long generation;
  private final ImmutableListMultimap<LookupKey, ResolvedMapping> roleMappings;
  private final ImmutableListMultimap<LookupKey, ResolvedMapping> userMappings;
  private final ImmutableMap<String, BackendMode> autoMappedAccounts;

  private MappingIndex(Builder builder) {
    this.partitionId = builder.partitionId;
    this.generation = builder.generation;
    this.roleMappings = builder.roleMappings.build();
    this.userMappings = builder.userMappings.build();
    this.autoMappedAccounts = ImmutableMap.copyOf(builder.autoMappedAccounts);
  }

  /** Returns a builder for an index of the given partition. */
  public static Builder builder(String partitionId) {
    return new Builder(partitionId);
  }

  /** Looks up a caller ARN. Malformed ARNs are never found. */
  public Optional<ResolvedMapping> lookup(String candidateArn) {
    return PrincipalArn.parse(candidateArn).flatMap(this::lookup);
  }

  /**
   * Looks up a parsed caller ARN.
   *
   * @return the winning explicit rule, else a synthesized rule if the caller's account is
   *     auto-mapped, else empty
   */
  public Optional<ResolvedMapping> lookup(PrincipalArn candidate) {
    ImmutableList<ResolvedMapping> rules =
        (candidate.kind() == MappingKind.ROLE ? roleMappings : userMappings)
            .get(LookupKey.of(candidate.partition(), candidate.accountId(), candidate.name()));
    if (!rules.isEmpty()) {
      for (ResolvedMapping rule : rules) {
        if (rule.pattern().path().equals(candidate.path())) {
          return Optional.of(rule);
        }
      }
      return Optional.of(rules.get(0));
    }
    BackendMode autoMappedBy = autoMappedAccounts.get(candidate.accountId());
    if (autoMappedBy != null && partitionId.equals(candidate.partition())) {
      String canonical = candidate.canonical();
      return Optional.of(
          ResolvedMapping.builder()
              .setArn(canonical)
              .setPattern(candidate)
              .setKind(candidate.kind())
              .setUsername(canonical)
              .setBackend(autoMappedBy)
              .setAutoMapped(true)
              .build());
    }
    return Optional.empty();
  }

  public String getPartitionId() {
    return partitionId;
  }

  /** Increasing number of the build that produced this index. */
  public long getGeneration() {
    return generation;
  }

  public int getRoleMappingCount() {
    return roleMappings.size();
  }

  public int getUserMappingCount() {
    return userMappings.size();
  }

  public int getAutoMappedAccountCount() {
    return autoMappedAccounts.size();
  }

  /** Builds a {@link MappingIndex}. Rules must be added in precedence order. */
  public static final class Builder {

    private final String partitionId;
    private long generation;
    private final ImmutableListMultimap.Builder<LookupKey, ResolvedMapping> roleMappings =
        ImmutableListMultimap.builder();
    private final ImmutableListMultimap.Builder<LookupKey, ResolvedMapping> userMappings =
        ImmutableListMultimap.builder();
    private final Map<String, BackendMode> autoMappedAccounts = new LinkedHashMap<>();

    private Builder(String partitionId) {
      this.partitionId = partitionId;
    }

    public Builder setGeneration(long generation) {
      this.generation = generation;
      return this;
    }

    /**
     * Adds a role mapping.
     *
     * @throws IllegalArgumentException if the role ARN is not a valid IAM role ARN
     */
    public Builder addRoleMapping(RoleMapping mapping, BackendMode backend) {
      ResolvedMapping rule =
          toRule(
              mapping.roleArn(), MappingKind.ROLE, mapping.username(), mapping.groups(), backend);
      roleMappings.put(keyOf(rule.pattern()), rule);
      return this;
    }

    /**
     * Adds a user mapping.
     *
     * @throws IllegalArgumentException if the user ARN is not a valid IAM user ARN
     */
    public Builder addUserMapping(UserMapping mapping, BackendMode backend) {
      ResolvedMapping rule =
          toRule(
              mapping.userArn(), MappingKind.USER, mapping.username(), mapping.groups(), backend);
      userMappings.put(keyOf(rule.pattern()), rule);
      return this;
    }

    /** Adds an auto-mapped account. The first backend to add an account is kept. */
    public Builder addAutoMappedAccount(String accountId, BackendMode backend) {
      autoMappedAccounts.putIfAbsent(accountId, backend);
      return this;
    }

    public MappingIndex build() {
      return new MappingIndex(this);
    }

    private static ResolvedMapping toRule(
        String arn,
        MappingKind kind,
        String username,
        ImmutableList<String> groups,
        BackendMode backend) {
      Optional<PrincipalArn> pattern = PrincipalArn.parse(arn);
      checkArgument(
          pattern.isPresent() && !pattern.get().isAssumedRole() && pattern.get().kind() == kind,
          "Not a valid IAM %s ARN: %s",
          kind.getResourceType(),
          arn);
      return ResolvedMapping.builder()
          .setArn(arn)
          .setPattern(pattern.get())
          .setKind(kind)
          .setUsername(username)
          .setGroups(groups)
          .setBackend(backend)
          .build();
    }

    private static LookupKey keyOf(PrincipalArn arn) {
      return LookupKey.of(arn.partition(), arn.accountId(), arn.name());
    }
  }

  @AutoValue
  abstract static class LookupKey {

    static LookupKey of(String partition, String accountId, String name) {
      return new AutoValue_MappingIndex_LookupKey(partition, accountId, name);
    }

    abstract String partition();

    abstract String accountId();

    abstract String name();
  }
}
