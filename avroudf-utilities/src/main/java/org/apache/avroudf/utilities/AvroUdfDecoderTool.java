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

package org.apache.avroudf.utilities;

import org.apache.avroudf.common.config.TypedProperties;
import org.apache.avroudf.exception.AvroUdfException;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line tool running one UDF event file through {@link UdfEventHandler} and printing the reply.
 *
 * <pre>
 *   java -cp avroudf-utilities.jar org.apache.avroudf.utilities.AvroUdfDecoderTool \
 *     --props udf.properties --conf avroudf.pipeline.mode=HEADER_FRAMED --event-file event.json
 * </pre>
 */
public class AvroUdfDecoderTool {

  private static final Logger LOG = LoggerFactory.getLogger(AvroUdfDecoderTool.class);

  private final Config cfg;

  public AvroUdfDecoderTool(Config cfg) {
    this.cfg = cfg;
  }

  public static class Config implements Serializable {

    @Parameter(names = {"--event-file", "-e"}, description = "Path to a JSON file holding one UDF invocation event", required = true)
    public String eventFile = null;

    @Parameter(names = {"--props"}, description = "path to properties file on localfs, with configurations for "
        + "the decode pipeline and schema registry")
    public String propsFilePath = null;

    @Parameter(names = {"--conf"}, description = "Any configuration that can be set in the properties file "
        + "(using the CLI parameter \"--props\") can also be passed command line using this parameter. This can be repeated",
        splitter = IdentitySplitter.class)
    public List<String> configs = new ArrayList<>();

    @Parameter(names = {"--help", "-h"}, help = true)
    public Boolean help = false;

    @Override
    public String toString() {
      return "AvroUdfDecoderToolConfig {\n"
          + "   --event-file " + eventFile + ", \n"
          + "   --props " + propsFilePath + ", \n"
          + "   --conf " + configs
          + "\n}";
    }
  }

  public String run() {
    LOG.info(cfg.toString());
    TypedProperties props = UtilHelpers.buildProperties(cfg.propsFilePath, System.getenv(), cfg.configs);
    String event;
    try {
      event = new String(Files.readAllBytes(Paths.get(cfg.eventFile)), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new AvroUdfException("Unable to read event file " + cfg.eventFile, e);
    }
    return new UdfEventHandler(props).handle(event);
  }

  public static void main(String[] args) {
    final Config cfg = new Config();
    JCommander cmd = new JCommander(cfg, null, args);
    if (cfg.help || args.length == 0) {
      cmd.usage();
      System.exit(1);
    }
    System.out.println(new AvroUdfDecoderTool(cfg).run());
  }
}
