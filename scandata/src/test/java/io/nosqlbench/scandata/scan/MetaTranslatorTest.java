package io.nosqlbench.scandata.scan;

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


import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class MetaTranslatorTest {

  @Test
  public void testStandardVocabulary() {
    MetaTranslator translator = MetaTranslator.standard();
    assertThat(translator.asMeta("wavelength")).contains("lam");
    assertThat(translator.asMeta("detector_distance")).contains("z");
    assertThat(translator.asMeta("detector_pixel_size")).contains("psize_det");
    assertThat(translator.asMeta("scan_label")).contains("label_original");
    assertThat(translator.asMeta("energy")).contains("energy");
    assertThat(translator.asMeta("bogus")).isEmpty();
    assertThat(translator.asScanInfo("lam")).contains("wavelength");
    assertThat(translator.asScanInfo("wavelength")).isEmpty();
  }

  @Test
  public void testMapTranslationDropsUnknownKeys() {
    Map<String, Object> scanInfo = new LinkedHashMap<>();
    scanInfo.put("wavelength", 1.0e-10);
    scanInfo.put("shape", new int[]{1, 2, 2});
    scanInfo.put("operator", "nobody");
    Map<String, Object> meta = MetaTranslator.standard().asMeta(scanInfo);
    assertThat(meta).containsOnlyKeys("lam", "shape");
    assertThat(MetaTranslator.standard().asScanInfo(meta)).containsOnlyKeys("wavelength", "shape");
  }

  @Test
  public void testCollidingRenames() {
    assertThatThrownBy(() -> new MetaTranslator(Map.of("energy", "wavelength")))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
