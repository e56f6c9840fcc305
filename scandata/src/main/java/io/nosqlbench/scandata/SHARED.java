package io.nosqlbench.scandata;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */


import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.reflect.TypeToken;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;

import java.lang.reflect.Type;
import java.util.Map;

/// Shared serialization helpers.
public class SHARED {
  /// pretty-printing gson instance, used for metadata attributes and diagnostics
  public final static Gson gson = new GsonBuilder().setPrettyPrinting().create();
  private final static LoadSettings loadSettings = LoadSettings.builder().setLabel("load").build();
  /// YAML loader for data source configuration
  public final static Load yamlLoader = new Load(loadSettings);

  /// @param json a JSON object
  /// @return the object as a map
  public static Map<String, Object> mapFromJson(String json) {
    Type type = new TypeToken<Map<String, Object>>() {}.getType();
    Map<String, Object> map = gson.fromJson(json, type);
    return map;
  }
}
