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


import io.nosqlbench.scandata.errors.ConfigException;
import io.nosqlbench.scandata.errors.ConsistencyException;
import io.nosqlbench.scandata.errors.DestinationConflictException;
import io.nosqlbench.scandata.parallel.CoordinationContext;
import io.nosqlbench.scandata.parallel.FrameIdentity;
import io.nosqlbench.scandata.parallel.PartitionAssigner;
import io.nosqlbench.scandata.store.DimSelector;
import io.nosqlbench.scandata.store.Hdf5ScanWriter;
import io.nosqlbench.scandata.store.IndexList;
import io.nosqlbench.scandata.store.Interval;
import io.nosqlbench.scandata.store.KeyedArrayStore;
import io.nosqlbench.scandata.store.NdArray;
import io.nosqlbench.scandata.store.ScanRecord;
import io.nosqlbench.scandata.store.ScanRecordWriter;
import io.nosqlbench.scandata.store.SliceSpec;
import io.nosqlbench.scandata.store.WriteMode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// The frames and metadata of one scan, as held by one worker.
///
/// A container starts out holding only metadata. [#load(LoadOptions)] reads the frames this
/// worker owns into bulk arrays and fills four per-frame view lists, `data`, `mask`, `dark` and
/// `flat`, each as long as the scan. Entry `i` of a view list is [FrameSlot.Owned] when this
/// worker holds frame `i` and [FrameSlot.Absent] otherwise. [#unload()] drops everything again.
///
/// All workers of a group must make the same sequence of calls on their containers. The
/// collective operations, [#gather(String)] and
/// [#save(Path, OverwritePolicy, OverwriteConfirmation)], exchange frames with the coordinator
/// and synchronize on barriers.
public class ScanContainer {

  private static final Logger logger = LogManager.getLogger(ScanContainer.class);

  /// the arrays a container loads, in save order
  public static final List<String> KEYS = List.of("data", "mask", "flat", "dark");

  private static final int UNOWNED = -1;

  private final ScanSource source;
  private final KeyedArrayStore store;
  private final CoordinationContext context;
  private final PartitionAssigner assigner;
  private final ScanRecordWriter writer;
  private final ScanMetadata metadata;
  private String label;

  private boolean loaded;
  private PartitionMode partition;
  private List<Integer> indices = List.of();
  private RegionOfInterest roi;
  private final Map<String, NdArray> arrays = new LinkedHashMap<>();
  private final Map<String, List<FrameSlot>> views = new LinkedHashMap<>();

  /// create a container holding only metadata
  /// @param source where the scan comes from
  /// @param overrides metadata by snake_case key, applied before the source's own metadata;
  ///     may be null
  /// @param context the worker this container belongs to
  public ScanContainer(ScanSource source, Map<String, ?> overrides, CoordinationContext context) {
    this(source, overrides, context, new PartitionAssigner(), new Hdf5ScanWriter());
  }

  /// create a container holding only metadata
  /// @param source where the scan comes from
  /// @param overrides metadata by snake_case key, applied before the source's own metadata;
  ///     may be null
  /// @param context the worker this container belongs to
  /// @param assigner the frame partitioning rule
  /// @param writer the writer used by [#save(Path, OverwritePolicy, OverwriteConfirmation)]
  public ScanContainer(
      ScanSource source,
      Map<String, ?> overrides,
      CoordinationContext context,
      PartitionAssigner assigner,
      ScanRecordWriter writer
  ) {
    this.source = source;
    this.context = context;
    this.assigner = assigner;
    this.writer = writer;
    this.metadata =
        ScanMetadata.DEFAULTS.overlay(overrides).overlay(source.metadataOverlay()).validate();
    this.label = metadata.scanLabel();
    this.store = source.openStore(metadata);
    clearViews();
  }

  /// Load this worker's frames.
  /// @param options the frame range, region of interest and partition mode
  public void load(LoadOptions options) {
    int frameCount = metadata.frameCount();
    int first = options.first();
    int last = options.last() == null ? frameCount : options.last();
    if (last - first <= 0) {
      throw new ConfigException(
          "scan " + label + " frame range [" + first + "," + last + ") is empty");
    }
    if (first < 0 || last > frameCount) {
      throw new ConfigException("scan " + label + " frame range [" + first + "," + last
          + ") lies outside its " + frameCount + " frames");
    }
    int rows = metadata.shape()[1];
    int cols = metadata.shape()[2];
    logger.info("scan {} frame size is {}x{}", label, rows, cols);

    DimSelector frames;
    List<Integer> owned = new ArrayList<>();
    if (options.partition() instanceof PartitionMode.ExplicitIndices explicit) {
      for (int index : explicit.indices()) {
        if (index < first || index >= last) {
          throw new ConfigException("scan " + label + " frame " + index + " lies outside [" + first
              + "," + last + ")");
        }
        owned.add(index);
      }
      frames = IndexList.of(owned);
    } else if (options.partition() instanceof PartitionMode.Auto) {
      List<FrameIdentity> identities = new ArrayList<>(last - first);
      for (int i = first; i < last; i++) {
        identities.add(new FrameIdentity(label, i));
      }
      Interval block = assigner.assign(identities, context.size(), context.rank());
      Interval absolute = new Interval(first + block.minIncl(), first + block.maxExcl());
      for (int i = absolute.minIncl(); i < absolute.maxExcl(); i++) {
        owned.add(i);
      }
      frames = absolute;
      logger.info("worker {} takes frames {} of scan {}", context.rank(), absolute.toData(), label);
    } else {
      for (int i = first; i < last; i++) {
        owned.add(i);
      }
      frames = new Interval(first, last);
    }

    if (options.roiSize() != null) {
      roi = RegionOfInterest.of(rows, cols, options.roiSize(), options.roiCenter());
      logger.info("scan {} loading region of interest {}", label, roi);
    } else {
      roi = RegionOfInterest.full(rows, cols);
      logger.info("scan {} loading full frames ({}x{})", label, rows, cols);
    }

    unload();
    partition = options.partition();
    indices = Collections.unmodifiableList(owned);
    if (!owned.isEmpty()) {
      SliceSpec slice = SliceSpec.of(frames, roi.rows(), roi.cols());
      logger.debug("worker {} reads scan {} with slice {}", context.rank(), label, slice.toData());
      FrameLoader loader = new FrameLoader(store, context);
      arrays.put("data", loader.load("data", slice, null, true).orElseThrow());
      loader.load("mask", slice, "fmask", false).ifPresent(a -> arrays.put("mask", a));
      loader.load("flat", slice, null, false).ifPresent(a -> arrays.put("flat", a));
      loader.load("dark", slice, null, false).ifPresent(a -> arrays.put("dark", a));
    }
    for (String key : KEYS) {
      NdArray array = arrays.get(key);
      if (array == null) {
        continue;
      }
      List<FrameSlot> view = views.get(key);
      for (int k = 0; k < owned.size(); k++) {
        view.set(owned.get(k), FrameSlot.owned(planeOf(key, array, k, owned.size())));
      }
    }
    loaded = true;
  }

  private float[][] planeOf(String key, NdArray array, int k, int ownedCount) {
    if (array.rank() == 2) {
      return array.asPlane();
    }
    if (array.rank() == 3 && array.dim(0) == ownedCount) {
      return array.plane(k);
    }
    throw new ConsistencyException("scan " + label + " array '" + key + "' has shape "
        + Arrays.toString(array.shape()) + " which does not hold " + ownedCount + " frames");
  }

  /// Drop all frames. The container can be loaded again.
  public void unload() {
    arrays.clear();
    clearViews();
    indices = List.of();
    partition = null;
    loaded = false;
  }

  private void clearViews() {
    views.clear();
    int frameCount = metadata.frameCount();
    for (String key : KEYS) {
      views.put(key, new ArrayList<>(Collections.nCopies(frameCount, FrameSlot.ABSENT)));
    }
  }

  /// @return true between [#load(LoadOptions)] and [#unload()]
  public boolean isLoaded() {
    return loaded;
  }

  /// Collect the frames of one view list on the coordinator.
  ///
  /// Every non-coordinator first sends the coordinator its frame count and the frames it holds.
  /// The coordinator rejects a group whose workers disagree on the frame count or where two
  /// workers hold the same frame, before any frame moves. Then, for every frame index in order,
  /// the worker holding the frame sends its slot tagged with the index, the coordinator
  /// receives it when the frame is held elsewhere, and all workers meet at a barrier. Frame
  /// ownership is that of the `data` view. A frame held by no worker stays
  /// [FrameSlot.Absent] on the coordinator.
  /// @param key one of [#KEYS]
  /// @return on the coordinator, the completed view list; elsewhere, this worker's view list
  public List<FrameSlot> gather(String key) {
    List<FrameSlot> view = requireView(key);
    if (!loaded) {
      throw new ConsistencyException("scan " + label + " was never loaded");
    }
    if (!context.isParallel() || partition instanceof PartitionMode.AllFrames) {
      return Collections.unmodifiableList(view);
    }
    List<FrameSlot> ownership = views.get("data");
    int[] owners = null;
    if (context.isCoordinator()) {
      owners = collectOwners(ownership);
    } else {
      context.send(
          new OwnershipManifest(context.rank(), ownership.size(), ownedIndices(ownership)));
    }
    context.barrier();
    for (int i = 0; i < view.size(); i++) {
      if (!context.isCoordinator()) {
        if (ownership.get(i).isOwned()) {
          context.send(new IndexedSlot(i, view.get(i)));
        }
      } else if (owners[i] != CoordinationContext.COORDINATOR && owners[i] != UNOWNED) {
        view.set(i, receiveSlot(key, i, owners[i]));
      }
      context.barrier();
    }
    logger.debug("worker {} gathered '{}' of scan {}", context.rank(), key, label);
    return Collections.unmodifiableList(view);
  }

  private static List<Integer> ownedIndices(List<FrameSlot> ownership) {
    List<Integer> owned = new ArrayList<>();
    for (int i = 0; i < ownership.size(); i++) {
      if (ownership.get(i).isOwned()) {
        owned.add(i);
      }
    }
    return owned;
  }

  private int[] collectOwners(List<FrameSlot> ownership) {
    int frameCount = metadata.frameCount();
    int[] owners = new int[frameCount];
    Arrays.fill(owners, UNOWNED);
    for (int index : ownedIndices(ownership)) {
      owners[index] = context.rank();
    }
    for (int n = 1; n < context.size(); n++) {
      Object message = context.receive();
      if (!(message instanceof OwnershipManifest manifest)) {
        throw new ConsistencyException(
            "scan " + label + " expected a frame ownership list but received " + message);
      }
      if (manifest.frameCount() != frameCount) {
        throw new ConsistencyException("worker " + manifest.rank() + " declares "
            + manifest.frameCount() + " frames for scan " + label + " but the coordinator declares "
            + frameCount);
      }
      for (int index : manifest.owned()) {
        if (owners[index] != UNOWNED) {
          throw new ConsistencyException("frame " + index + " of scan " + label
              + " is held by both worker " + owners[index] + " and worker " + manifest.rank());
        }
        owners[index] = manifest.rank();
      }
    }
    return owners;
  }

  private FrameSlot receiveSlot(String key, int index, int owner) {
    Object message = context.receive();
    if (!(message instanceof IndexedSlot slot) || slot.index() != index) {
      throw new ConsistencyException("scan " + label + " expected frame " + index + " of '" + key
          + "' from worker " + owner + " but received " + message);
    }
    return slot.slot();
  }

  /// Save the whole scan. With several workers, the frames are first gathered on the
  /// coordinator, which then writes the file alone.
  /// @param destination the file to write, or null for the scan's `data_filename`
  /// @param policy what to do when the file exists
  /// @param confirmation asked when the policy is [OverwritePolicy#ASK]; may be null
  /// @return the written file on the coordinator, empty on other workers
  public Optional<Path> save(
      Path destination,
      OverwritePolicy policy,
      OverwriteConfirmation confirmation
  ) {
    if (!loaded) {
      throw new ConsistencyException(
          "attempting to save scan " + label + " which does not contain data");
    }
    Map<String, NdArray> output = new LinkedHashMap<>();
    if (context.isParallel()) {
      for (String key : KEYS) {
        gather(key);
      }
      if (!context.isCoordinator()) {
        context.barrier();
        return Optional.empty();
      }
      output.put("data", stack("data", true));
      output.put("mask", stack("mask", false));
      output.put("flat", sharedOrStacked("flat"));
      output.put("dark", sharedOrStacked("dark"));
    } else {
      for (String key : KEYS) {
        output.put(key, arrays.get(key));
      }
    }

    NdArray data = output.get("data");
    if (data == null) {
      throw new ConsistencyException("scan " + label + " holds no frames to save");
    }
    if (!Arrays.equals(data.shape(), metadata.shape())) {
      throw new ConsistencyException("attempting to save scan " + label
          + " with non-native data dimension [data shape = " + Arrays.toString(data.shape())
          + ", while scan_info shape = " + Arrays.toString(metadata.shape()) + "]");
    }

    Path target = resolveDestination(destination);
    if (Files.exists(target)) {
      switch (policy) {
        case FORCE -> logger.warn("save file {} exists but will be overwritten", target);
        case REFUSE -> throw new DestinationConflictException(
            "file " + target + " exists, operation cancelled");
        case ASK -> {
          if (confirmation == null || !confirmation.confirm(target)) {
            throw new DestinationConflictException(
                "file " + target + " exists, operation cancelled by user");
          }
        }
      }
    }

    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put(FileScanSource.SCAN_INFO,
        metadata.withDataFilename(target.toString()).toJson());
    writer.write(target, new ScanRecord(output, attributes), WriteMode.RELAXED);
    logger.info("scan {} data saved to {}", label, target);
    if (context.isParallel()) {
      context.barrier();
    }
    return Optional.of(target);
  }

  private NdArray stack(String key, boolean required) {
    List<FrameSlot> view = views.get(key);
    if (!required && view.stream().noneMatch(FrameSlot::isOwned)) {
      return null;
    }
    List<float[][]> planes = new ArrayList<>(view.size());
    for (int i = 0; i < view.size(); i++) {
      FrameSlot slot = view.get(i);
      if (!slot.isOwned()) {
        throw new ConsistencyException(
            "scan " + label + " frame " + i + " of '" + key + "' is missing after gathering");
      }
      planes.add(slot.plane());
    }
    return NdArray.stack(planes);
  }

  private NdArray sharedOrStacked(String key) {
    NdArray local = arrays.get(key);
    if (local != null && local.rank() == 2) {
      return local;
    }
    return stack(key, false);
  }

  private Path resolveDestination(Path destination) {
    String name = destination != null ? destination.toString() : metadata.dataFilename();
    if (name == null) {
      throw new ConfigException("scan " + label + " has no destination and no data_filename");
    }
    if (name.equals("~") || name.startsWith("~/")) {
      name = System.getProperty("user.home") + name.substring(1);
    }
    return Path.of(name).toAbsolutePath().normalize();
  }

  /// Package owned frames for a reconstruction model.
  /// @param translator the metadata vocabulary of the model
  /// @param start the first frame index
  /// @param stop the end index, exclusive; null or beyond the frame count means the frame count
  /// @return the frames of `[start, stop)` held by this worker
  public DataPackage asDataPackage(MetaTranslator translator, int start, Integer stop) {
    int frameCount = metadata.frameCount();
    int end = stop == null || stop > frameCount ? frameCount : stop;
    Map<String, Object> common = new LinkedHashMap<>();
    translator.asMeta(metadata.toMap()).forEach((key, value) -> {
      if (value != null) {
        common.put(key, value);
      }
    });
    common.put("label", label);

    List<FramePackage> frames = new ArrayList<>();
    List<FrameSlot> data = views.get("data");
    List<FrameSlot> mask = views.get("mask");
    for (int i = Math.max(0, start); i < end; i++) {
      if (!data.get(i).isOwned()) {
        continue;
      }
      float[][] maskPlane = mask.get(i).isOwned() ? mask.get(i).plane() : null;
      frames.add(new FramePackage(data.get(i).plane(), maskPlane, i, metadata.position(i)));
    }
    return new DataPackage(common, frames);
  }

  private List<FrameSlot> requireView(String key) {
    List<FrameSlot> view = views.get(key);
    if (view == null) {
      throw new IllegalArgumentException("no view named '" + key + "', expected one of " + KEYS);
    }
    return view;
  }

  /// @param key one of [#KEYS]
  /// @return the view list, as long as the scan
  public List<FrameSlot> getView(String key) {
    return Collections.unmodifiableList(requireView(key));
  }

  /// @param key one of [#KEYS]
  /// @return the bulk array loaded for this worker, if any
  public Optional<NdArray> getArray(String key) {
    return Optional.ofNullable(arrays.get(key));
  }

  /// @return the absolute indices of the frames this worker loaded
  public List<Integer> getIndices() {
    return indices;
  }

  /// @return the region of interest of the last load, or null before the first load
  public RegionOfInterest getRegionOfInterest() {
    return roi;
  }

  /// @return the scan metadata
  public ScanMetadata getMetadata() {
    return metadata;
  }

  /// @return the scan label
  public String getLabel() {
    return label;
  }

  /// @param label the label this scan is known by among other scans
  public void setLabel(String label) {
    this.label = label;
  }

  /// @return the source of the scan
  public ScanSource getSource() {
    return source;
  }

  @Override
  public String toString() {
    return "ScanContainer{" + label + ", " + source + (loaded ? ", loaded " + indices.size()
        + " frames" : "") + "}";
  }

  /// the frames a non-coordinator holds, sent before any frame of a gather
  private record OwnershipManifest(int rank, int frameCount, List<Integer> owned) {
  }

  /// one gathered frame, tagged with its index
  private record IndexedSlot(int index, FrameSlot slot) {
  }
}
