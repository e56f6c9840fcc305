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


import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.scandata.SHARED;
import io.nosqlbench.scandata.errors.ConfigException;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Physical and provenance information about one scan. All physical distances are in meters.
///
/// Instances are immutable: array components are copied on the way in and on the way out, and
/// equality compares array contents. Overrides are applied with [#overlay(Map)], which accepts the
/// snake_case field names used in scan files, such as `scan_label` or `detector_distance`.
///
/// @param scanNumber the scan number
/// @param scanLabel a label for the scan, or a template like `Scan%02d` which is formatted with
///     the ordinal of the scan
/// @param dataFilename the file the scan is saved to
/// @param wavelength the radiation wavelength
/// @param energy the photon energy
/// @param detectorPixelSize the detector pixel dimensions
/// @param detectorDistance the distance between detector and sample
/// @param initialCenter the position of the frame center in the full detector frame
/// @param dateCollected when the data was collected
/// @param dateProcessed when the data was processed
/// @param exposureTime the exposure time in seconds
/// @param preparationBasepath the base path used for data preparation
/// @param preparationOther other preparation details
/// @param shape the `(frames, rows, columns)` shape of the data
/// @param positions the measured sample position of each frame
/// @param positionsTheory the expected sample position of each frame
/// @param scanCommand the command which ran the scan
public record ScanMetadata(
    @SerializedName("scan_number") Integer scanNumber,
    @SerializedName("scan_label") String scanLabel,
    @SerializedName("data_filename") String dataFilename,
    @SerializedName("wavelength") Double wavelength,
    @SerializedName("energy") Double energy,
    @SerializedName("detector_pixel_size") double[] detectorPixelSize,
    @SerializedName("detector_distance") Double detectorDistance,
    @SerializedName("initial_ctr") double[] initialCenter,
    @SerializedName("date_collected") String dateCollected,
    @SerializedName("date_processed") String dateProcessed,
    @SerializedName("exposure_time") Double exposureTime,
    @SerializedName("preparation_basepath") String preparationBasepath,
    @SerializedName("preparation_other") String preparationOther,
    @SerializedName("shape") int[] shape,
    @SerializedName("positions") double[][] positions,
    @SerializedName("positions_theory") double[][] positionsTheory,
    @SerializedName("scan_command") String scanCommand
) {

  public ScanMetadata {
    detectorPixelSize = copy(detectorPixelSize);
    initialCenter = copy(initialCenter);
    shape = shape == null ? null : shape.clone();
    positions = copy(positions);
    positionsTheory = copy(positionsTheory);
  }

  /// The field names, in file order
  public static final List<String> KEYS = List.of(
      "scan_number", "scan_label", "data_filename", "wavelength", "energy",
      "detector_pixel_size", "detector_distance", "initial_ctr", "date_collected",
      "date_processed", "exposure_time", "preparation_basepath", "preparation_other", "shape",
      "positions", "positions_theory", "scan_command"
  );

  /// Fields which hold a pair and accept a single number for both components
  private static final List<String> PAIRS = List.of("detector_pixel_size", "initial_ctr");

  /// The defaults every scan starts from
  public static final ScanMetadata DEFAULTS = new ScanMetadata(
      null, "Scan%02d", null, null, null, null, null, null, null, null, null, null, null,
      new int[]{10, 96, 96}, null, null, null
  );

  /// Apply overrides, keyed by snake_case field name. Unknown keys are ignored.
  /// @param overrides the values to replace; may be null
  /// @return the updated metadata
  public ScanMetadata overlay(Map<String, ?> overrides) {
    if (overrides == null || overrides.isEmpty()) {
      return this;
    }
    JsonObject tree = SHARED.gson.toJsonTree(this).getAsJsonObject();
    overrides.forEach((key, value) -> {
      Object normalized = PAIRS.contains(key) && value instanceof Number n
          ? new double[]{n.doubleValue(), n.doubleValue()} : value;
      JsonElement element = SHARED.gson.toJsonTree(normalized);
      tree.add(key, element);
    });
    try {
      return SHARED.gson.fromJson(tree, ScanMetadata.class);
    } catch (RuntimeException e) {
      throw new ConfigException("invalid scan metadata overrides " + overrides.keySet(), e);
    }
  }

  @Override
  public double[] detectorPixelSize() {
    return copy(detectorPixelSize);
  }

  @Override
  public double[] initialCenter() {
    return copy(initialCenter);
  }

  @Override
  public int[] shape() {
    return shape == null ? null : shape.clone();
  }

  @Override
  public double[][] positions() {
    return copy(positions);
  }

  @Override
  public double[][] positionsTheory() {
    return copy(positionsTheory);
  }

  /// @param json the JSON form written by [#toJson()]
  /// @return the defaults overlaid with the JSON fields
  public static ScanMetadata fromJson(String json) {
    return DEFAULTS.overlay(SHARED.mapFromJson(json));
  }

  /// @return the JSON form, omitting unset fields
  public String toJson() {
    return SHARED.gson.toJson(this);
  }

  /// @return all fields by snake_case name, in file order, including unset ones as null
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("scan_number", scanNumber);
    map.put("scan_label", scanLabel);
    map.put("data_filename", dataFilename);
    map.put("wavelength", wavelength);
    map.put("energy", energy);
    map.put("detector_pixel_size", detectorPixelSize());
    map.put("detector_distance", detectorDistance);
    map.put("initial_ctr", initialCenter());
    map.put("date_collected", dateCollected);
    map.put("date_processed", dateProcessed);
    map.put("exposure_time", exposureTime);
    map.put("preparation_basepath", preparationBasepath);
    map.put("preparation_other", preparationOther);
    map.put("shape", shape());
    map.put("positions", positions());
    map.put("positions_theory", positionsTheory());
    map.put("scan_command", scanCommand);
    return map;
  }

  /// @return the number of frames in the scan
  public int frameCount() {
    return shape[0];
  }

  /// @return the `(rows, columns)` shape of one frame
  public int[] frameShape() {
    return new int[]{shape[1], shape[2]};
  }

  /// @param index a frame index
  /// @return the measured position of the frame, or null if positions are unknown
  public double[] position(int index) {
    return positions == null ? null : copy(positions[index]);
  }

  /// Check that the shape is a frame stack and that positions cover every frame.
  /// @return this metadata
  public ScanMetadata validate() {
    if (shape == null || shape.length != 3) {
      throw new ConfigException(
          "scan shape must be (frames, rows, columns), not " + Arrays.toString(shape));
    }
    for (int extent : shape) {
      if (extent < 0) {
        throw new ConfigException("scan shape " + Arrays.toString(shape) + " has a negative extent");
      }
    }
    if (positions != null && positions.length != shape[0]) {
      throw new ConfigException(
          "scan has " + shape[0] + " frames but " + positions.length + " positions");
    }
    return this;
  }

  /// @param filename the file the scan is saved to
  /// @return a copy with the file name replaced
  public ScanMetadata withDataFilename(String filename) {
    return new ScanMetadata(scanNumber, scanLabel, filename, wavelength, energy, detectorPixelSize,
        detectorDistance, initialCenter, dateCollected, dateProcessed, exposureTime,
        preparationBasepath, preparationOther, shape, positions, positionsTheory, scanCommand);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ScanMetadata other
        && Arrays.deepEquals(toMap().values().toArray(), other.toMap().values().toArray());
  }

  @Override
  public int hashCode() {
    return Arrays.deepHashCode(toMap().values().toArray());
  }

  private static double[] copy(double[] values) {
    return values == null ? null : values.clone();
  }

  private static double[][] copy(double[][] rows) {
    if (rows == null) {
      return null;
    }
    double[][] copy = new double[rows.length][];
    for (int i = 0; i < rows.length; i++) {
      copy[i] = copy(rows[i]);
    }
    return copy;
  }

}
