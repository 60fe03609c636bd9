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

import org.apache.avroudf.common.util.StringUtils;
import org.apache.avroudf.config.AvroUdfAWSConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.core.exception.SdkClientException;

import java.util.Properties;

/**
 * Static key pair taken from {@code avroudf.aws.access.key} and {@code avroudf.aws.secret.key}, with
 * {@code avroudf.aws.session.token} turning it into session credentials.
 * <p>
 * An incomplete pair resolves to an {@link SdkClientException}, which lets a chain fall through to
 * the SDK's default lookup.
 */
public class AvroUdfConfigAWSCredentialsProvider implements AwsCredentialsProvider {

  private static final Logger LOG = LoggerFactory.getLogger(AvroUdfConfigAWSCredentialsProvider.class);

  private final AwsCredentials awsCredentials;

  public AvroUdfConfigAWSCredentialsProvider(Properties props) {
    String accessKey = props.getProperty(AvroUdfAWSConfig.AWS_ACCESS_KEY.key());
    String secretKey = props.getProperty(AvroUdfAWSConfig.AWS_SECRET_KEY.key());
    if (StringUtils.isNullOrEmpty(accessKey) || StringUtils.isNullOrEmpty(secretKey)) {
      LOG.debug("Skipping configured AWS keys, {} is unset",
          StringUtils.isNullOrEmpty(accessKey) ? AvroUdfAWSConfig.AWS_ACCESS_KEY.key() : AvroUdfAWSConfig.AWS_SECRET_KEY.key());
      this.awsCredentials = null;
      return;
    }
    String sessionToken = props.getProperty(AvroUdfAWSConfig.AWS_SESSION_TOKEN.key());
    this.awsCredentials = StringUtils.isNullOrEmpty(sessionToken)
        ? AwsBasicCredentials.create(accessKey, secretKey)
        : AwsSessionCredentials.create(accessKey, secretKey, sessionToken);
  }

  public boolean hasCredentials() {
    return awsCredentials != null;
  }

  @Override
  public AwsCredentials resolveCredentials() {
    if (awsCredentials == null) {
      throw SdkClientException.create("Both " + AvroUdfAWSConfig.AWS_ACCESS_KEY.key() + " and "
          + AvroUdfAWSConfig.AWS_SECRET_KEY.key() + " must be set to use configured AWS keys");
    }
    return awsCredentials;
  }
}
