/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.avroudf.aws.credentials;

import org.apache.avroudf.common.config.AvroUdfConfig;
import org.apache.avroudf.config.AvroUdfAWSConfig;

import org.junit.jupiter.api.Test;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.core.exception.SdkClientException;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TestAvroUdfAWSCredentialsProviderFactory {

  @Test
  public void testGetAWSCredentials() {
    AvroUdfConfig cfg = new AvroUdfConfig();
    cfg.setValue(AvroUdfAWSConfig.AWS_ACCESS_KEY, "random-access-key");
    cfg.setValue(AvroUdfAWSConfig.AWS_SECRET_KEY, "random-secret-key");
    cfg.setValue(AvroUdfAWSConfig.AWS_SESSION_TOKEN, "random-session-token");
    AwsSessionCredentials credentials = (AwsSessionCredentials) AvroUdfAWSCredentialsProviderFactory
        .getAwsCredentialsProvider(cfg.getProps()).resolveCredentials();
    assertEquals("random-access-key", credentials.accessKeyId());
    assertEquals("random-secret-key", credentials.secretAccessKey());
    assertEquals("random-session-token", credentials.sessionToken());
  }

  @Test
  public void testBasicCredentialsWithoutSessionToken() {
    Properties props = AvroUdfAWSConfig.newBuilder()
        .withAccessKey("random-access-key")
        .withSecretKey("random-secret-key")
        .build()
        .getProps();
    AvroUdfConfigAWSCredentialsProvider provider = new AvroUdfConfigAWSCredentialsProvider(props);
    assertTrue(provider.hasCredentials());
    AwsCredentials credentials = provider.resolveCredentials();
    assertInstanceOf(AwsBasicCredentials.class, credentials);
    assertEquals("random-secret-key", credentials.secretAccessKey());
  }

  @Test
  public void testNoConfiguredKeys() {
    AvroUdfConfigAWSCredentialsProvider provider = new AvroUdfConfigAWSCredentialsProvider(new Properties());
    assertFalse(provider.hasCredentials());
    assertThrows(SdkClientException.class, provider::resolveCredentials);
  }

  @Test
  public void testAccessKeyWithoutSecretKey() {
    Properties props = new Properties();
    props.setProperty(AvroUdfAWSConfig.AWS_ACCESS_KEY.key(), "random-access-key");
    props.setProperty(AvroUdfAWSConfig.AWS_SESSION_TOKEN.key(), "random-session-token");
    AvroUdfConfigAWSCredentialsProvider provider = new AvroUdfConfigAWSCredentialsProvider(props);

    assertFalse(provider.hasCredentials());
    SdkClientException e = assertThrows(SdkClientException.class, provider::resolveCredentials);
    assertTrue(e.getMessage().contains(AvroUdfAWSConfig.AWS_SECRET_KEY.key()));
  }
}
