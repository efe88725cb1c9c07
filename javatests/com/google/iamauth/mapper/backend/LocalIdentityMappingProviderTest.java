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

package com.google.iamauth.mapper.backend;

import static com.google.common.truth.Truth.assertThat;
import static com.google.iamauth.mapper.model.ErrorReason.BACKEND_UNAVAILABLE;
import static com.google.iamauth.mapper.model.ErrorReason.MALFORMED_BACKEND_DATA;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.iamauth.mapper.backend.MappingSource.MappingSourceException;
import com.google.iamauth.mapper.config.YamlObjectMapper;
import com.google.iamauth.mapper.model.IdentityMapping;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class LocalIdentityMappingProviderTest {

  @Rule public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void listIdentityMappings_fromResourceList() throws Exception {
    Path path =
        write(
            "apiVersion: v1",
            "kind: List",
            "items:",
            "  - apiVersion: iamauthenticator.k8s.aws/v1alpha1",
            "    kind: IAMIdentityMapping",
            "    metadata:",
            "      name: kubernetes-admin",
            "    spec:",
            "      arn: arn:aws:iam::123456789012:user/KubernetesAdmin",
            "      username: kubernetes-admin",
            "      groups:",
            "        - system:masters",
            "    status:",
            "      canonicalARN: arn:aws:iam::123456789012:user/kubernetesadmin",
            "  - metadata:",
            "      name: nodes",
            "    spec:",
            "      arn: arn:aws:iam::123456789012:role/KubernetesNode",
            "      username: system:node:{{SessionName}}");

    ImmutableList<IdentityMapping> mappings =
        new LocalIdentityMappingProvider(path, new YamlObjectMapper()).listIdentityMappings();

    assertThat(mappings)
        .containsExactly(
            IdentityMapping.builder()
                .setIdentityArn("arn:aws:iam::123456789012:user/KubernetesAdmin")
                .setUsername("kubernetes-admin")
                .setGroups(ImmutableList.of("system:masters"))
                .build(),
            IdentityMapping.builder()
                .setIdentityArn("arn:aws:iam::123456789012:role/KubernetesNode")
                .setUsername("system:node:{{SessionName}}")
                .build())
        .inOrder();
  }

  @Test
  public void listIdentityMappings_fromRootArray() throws Exception {
    Path path =
        write(
            "- spec:",
            "    arn: arn:aws:iam::123456789012:role/Admin",
            "    username: admin");

    assertThat(
            new LocalIdentityMappingProvider(path, new YamlObjectMapper()).listIdentityMappings())
        .hasSize(1);
  }

  @Test
  public void listIdentityMappings_missingFile_unavailable() {
    LocalIdentityMappingProvider provider =
        new LocalIdentityMappingProvider(
            folder.getRoot().toPath().resolve("missing.yaml"), new YamlObjectMapper());

    MappingSourceException e =
        assertThrows(MappingSourceException.class, provider::listIdentityMappings);

    assertThat(e.getReason()).isEqualTo(BACKEND_UNAVAILABLE);
  }

  @Test
  public void listIdentityMappings_itemWithoutSpec_malformed() throws Exception {
    LocalIdentityMappingProvider provider =
        new LocalIdentityMappingProvider(
            write("items:", "  - metadata:", "      name: broken"), new YamlObjectMapper());

    MappingSourceException e =
        assertThrows(MappingSourceException.class, provider::listIdentityMappings);

    assertThat(e.getReason()).isEqualTo(MALFORMED_BACKEND_DATA);
  }

  @Test
  public void listIdentityMappings_specWithoutArn_malformed() throws Exception {
    LocalIdentityMappingProvider provider =
        new LocalIdentityMappingProvider(
            write("items:", "  - spec:", "      username: nobody"), new YamlObjectMapper());

    MappingSourceException e =
        assertThrows(MappingSourceException.class, provider::listIdentityMappings);

    assertThat(e.getReason()).isEqualTo(MALFORMED_BACKEND_DATA);
  }

  private Path write(String... lines) throws IOException {
    Path path = folder.newFile().toPath();
    Files.write(path, String.join("\n", lines).getBytes(UTF_8));
    return path;
  }
}
