package io.nosqlbench.scandata.feed;

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


import io.nosqlbench.scandata.errors.ConfigException;
import io.nosqlbench.scandata.errors.DuplicateLabelException;
import io.nosqlbench.scandata.parallel.CoordinationContext;
import io.nosqlbench.scandata.scan.DataPackage;
import io.nosqlbench.scandata.scan.MetaTranslator;
import io.nosqlbench.scandata.scan.ScanContainer;
import io.nosqlbench.scandata.scan.ScanSources;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IllegalFormatException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Combines several scans into one feed of data packages for a reconstruction model.
///
/// Every source gets a scan container holding only metadata until its frames are delivered.
/// Scans are kept in the order given, under unique labels. The batching is decided by a
/// [DeliveryStrategy].
public class ScanAggregator {

  private static final Logger logger = LogManager.getLogger(ScanAggregator.class);

  private final Map<String, ScanContainer> scans = new LinkedHashMap<>();
  private final CoordinationContext context;
  private final MetaTranslator translator;
  private final DeliveryStrategy delivery;
  private final long totalFrames;
  private boolean available;

  /// create an aggregator
  /// @param sources the scan sources, in delivery order; see [ScanSources#of(Object)]
  /// @param overrides metadata overrides for each source by position; may be shorter than
  ///     `sources`, or null
  /// @param labels labels for each source by position; may be shorter than `sources`, hold
  ///     nulls, or be null
  /// @param context the worker this aggregator runs on
  /// @param translator the metadata vocabulary of the consumer
  /// @param delivery how scans are cut into batches
  public ScanAggregator(
      List<?> sources,
      List<? extends Map<String, ?>> overrides,
      List<String> labels,
      CoordinationContext context,
      MetaTranslator translator,
      DeliveryStrategy delivery
  ) {
    this.context = context;
    this.translator = translator;
    this.delivery = delivery;
    long total = 0;
    for (int i = 0; i < sources.size(); i++) {
      Map<String, ?> pars = overrides != null && i < overrides.size() ? overrides.get(i) : null;
      ScanContainer scan = new ScanContainer(ScanSources.of(sources.get(i)), pars, context);
      String explicit = labels != null && i < labels.size() ? labels.get(i) : null;
      String label = resolveLabel(explicit, scan.getLabel(), i, scans.keySet());
      scan.setLabel(label);
      scans.put(label, scan);
      total += scan.getMetadata().frameCount();
      logger.debug("added scan {} from {} with {} frames", label, scan.getSource(),
          scan.getMetadata().frameCount());
    }
    this.totalFrames = total;
    this.available = total > 0;
    logger.info("aggregating {} scans with {} frames in total", scans.size(), totalFrames);
  }

  /// Choose the label of a scan.
  ///
  /// An explicit label is used when it is not yet taken. Otherwise the scan's own label is
  /// used: a template such as `Scan%02d`, or the older `Scan%(idx)02d`, is formatted with the
  /// ordinal; a plain label is used as is when free and suffixed with `_` and the two digit
  /// ordinal when taken.
  /// @param explicit the requested label; may be null
  /// @param ownLabel the label or label template from the scan metadata
  /// @param ordinal the position of the scan among all scans
  /// @param used the labels already taken
  /// @return the label
  /// @throws DuplicateLabelException if the fallback label is taken too
  public static String resolveLabel(String explicit, String ownLabel, int ordinal,
                                    Set<String> used) {
    if (explicit != null && !used.contains(explicit)) {
      return explicit;
    }
    String fallback;
    if (ownLabel == null) {
      fallback = String.format("Scan%02d", ordinal);
    } else if (ownLabel.contains("%")) {
      try {
        fallback = String.format(ownLabel.replace("%(idx)", "%"), ordinal);
      } catch (IllegalFormatException e) {
        throw new ConfigException("invalid scan label template '" + ownLabel + "'", e);
      }
    } else if (!used.contains(ownLabel)) {
      fallback = ownLabel;
    } else {
      fallback = ownLabel + String.format("_%02d", ordinal);
    }
    if (used.contains(fallback)) {
      throw new DuplicateLabelException(fallback);
    }
    return fallback;
  }

  /// @return the next batches, as decided by the delivery strategy
  public Iterator<DataPackage> feed() {
    return delivery.feed(this);
  }

  /// @return true while frames remain to be delivered
  public boolean isAvailable() {
    return available;
  }

  /// Record that every frame was delivered.
  void markExhausted() {
    if (available) {
      logger.info("all {} frames delivered", totalFrames);
    }
    available = false;
  }

  /// @return the declared frame count of all scans together
  public long getTotalFrames() {
    return totalFrames;
  }

  /// @return the scan labels, in delivery order
  public List<String> getLabels() {
    return List.copyOf(scans.keySet());
  }

  /// @return the scans, in delivery order
  public List<ScanContainer> getScans() {
    return Collections.unmodifiableList(new ArrayList<>(scans.values()));
  }

  /// @param label a scan label
  /// @return the scan with that label, or null
  public ScanContainer getScan(String label) {
    return scans.get(label);
  }

  /// @return the consumer's metadata vocabulary
  public MetaTranslator getTranslator() {
    return translator;
  }

  /// @return the worker this aggregator runs on
  public CoordinationContext getContext() {
    return context;
  }

  /// @return the delivery strategy
  public DeliveryStrategy getDelivery() {
    return delivery;
  }
}
