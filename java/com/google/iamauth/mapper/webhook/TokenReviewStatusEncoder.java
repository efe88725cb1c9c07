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

package com.google.iamauth.mapper.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.iamauth.mapper.model.PlatformIdentity;
import com.google.iamauth.mapper.model.ResolutionResult;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Encodes a {@link ResolutionResult} as the {@link TokenReview} response of the authentication
 * webhook. Only {@link ResolutionResult.Outcome#ALLOWED} is authenticated.
 */
@Singleton
public final class TokenReviewStatusEncoder {

  public static final String EXTRA_ARN = "arn";
  public static final String EXTRA_ACCOUNT_ID = "accountId";
  public static final String EXTRA_SESSION_NAME = "sessionName";

  private final ObjectMapper mapper;

  @Inject
  public TokenReviewStatusEncoder() {
    this.mapper = new ObjectMapper();
    mapper.registerModule(new GuavaModule());
    mapper.registerModule(new Jdk8Module());
  }

  /** Builds the response object for a resolution. */
  public TokenReview encode(ResolutionResult result) {
    TokenReview.Status.Builder status = TokenReview.Status.builder();
    if (result.isAllowed()) {
      status.setAuthenticated(true).setUser(userInfoOf(result.identity().get()));
    } else {
      status.setAuthenticated(false);
      result.detail().ifPresent(status::setError);
    }
    return TokenReview.builder().setStatus(status.build()).build();
  }

  /**
   * Builds the JSON response body for a resolution.
   *
   * @throws JsonProcessingException if the response could not be serialized
   */
  public String encodeToJson(ResolutionResult result) throws JsonProcessingException {
    return mapper.writeValueAsString(encode(result));
  }

  private static TokenReview.UserInfo userInfoOf(PlatformIdentity identity) {
    ImmutableMap.Builder<String, ImmutableList<String>> extra = ImmutableMap.builder();
    extra.put(EXTRA_ARN, ImmutableList.of(identity.arn()));
    extra.put(EXTRA_ACCOUNT_ID, ImmutableList.of(identity.accountId()));
    identity
        .sessionName()
        .ifPresent(sessionName -> extra.put(EXTRA_SESSION_NAME, ImmutableList.of(sessionName)));
    return TokenReview.UserInfo.builder()
        .setUsername(identity.username())
        .setGroups(identity.groups())
        .setExtra(extra.build())
        .build();
  }
}
