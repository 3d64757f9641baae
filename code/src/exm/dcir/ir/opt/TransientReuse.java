/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package exm.dcir.ir.opt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.apache.log4j.Logger;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import com.google.common.collect.SetMultimap;

import exm.dcir.common.Settings;
import exm.dcir.common.lang.SymExpr;
import exm.dcir.ir.tree.AccessNode;
import exm.dcir.ir.tree.Edge;
import exm.dcir.ir.tree.Program;
import exm.dcir.ir.tree.Region;

/**
 * Merge transient buffers with disjoint lifetimes in the same region
 * into shared buffers, reducing total transient memory.
 *
 * Only transients accessed from exactly one region are considered.
 * Nested programs are left alone.
 */
public class TransientReuse implements OptimizerPass {

  @Override
  public String getPassName() {
    return "Transient reuse";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.OPT_TRANSIENT_REUSE;
  }

  @Override
  public void optimize(Logger logger, Program program) {
    apply(logger, program);
  }

  public ReuseReport apply(Logger logger, Program program) {
    SymExpr before = transientBytes(program);

    Set<String> candidates = findCandidates(program);
    logger.trace("Reuse candidates: " + candidates);

    List<List<String>> merged = new ArrayList<List<String>>();
    Map<String, String> renames = new TreeMap<String, String>();
    for (Region region: program.getRegions()) {
      TransientLiveness live = TransientLiveness.analyze(region);
      Set<String> local = new TreeSet<String>();
      for (String data: region.accessedData()) {
        if (candidates.contains(data) && live.isBounded(data)) {
          local.add(data);
        }
      }
      if (local.size() < 2) {
        continue;
      }

      SetMultimap<String, String> merges = live.legalMerges(program, local);
      List<List<String>> buckets = ReuseBuckets.assign(local, merges);
      Map<String, String> regionRenames = ReuseBuckets.synthesize(program,
                                                                 buckets);
      for (List<String> bucket: buckets) {
        if (bucket.size() > 1) {
          logger.debug("Region " + region.getLabel() + ": " + bucket +
                       " -> " + regionRenames.get(bucket.get(0)));
          merged.add(Collections.unmodifiableList(bucket));
        }
      }
      rename(region, regionRenames);
      renames.putAll(regionRenames);
    }

    Set<String> removed = removeUnusedBuffers(program);
    logger.trace("Removed buffers: " + removed);

    SymExpr after = transientBytes(program);
    logger.info("Transient memory before reuse: " + before + " bytes");
    logger.info("Transient memory after reuse: " + after + " bytes");
    logger.info("Transient memory saved: " + SymExpr.sub(before, after) +
                " bytes");
    return new ReuseReport(before, after, merged, renames);
  }

  /**
   * @return transients accessed from exactly one region
   */
  static Set<String> findCandidates(Program program) {
    Multiset<String> regionCount = HashMultiset.create();
    for (Region region: program.getRegions()) {
      regionCount.addAll(region.accessedData());
    }
    Set<String> result = new TreeSet<String>();
    for (String t: program.transientNames()) {
      if (regionCount.count(t) == 1) {
        result.add(t);
      }
    }
    return result;
  }

  /**
   * Rename access nodes and the memlets along every memlet tree
   * touching them.
   */
  static void rename(Region region, Map<String, String> renames) {
    for (Map.Entry<String, String> r: renames.entrySet()) {
      String oldName = r.getKey();
      String newName = r.getValue();
      for (AccessNode a: region.accessNodes()) {
        if (!a.getData().equals(oldName)) {
          continue;
        }
        a.setData(newName);
        for (Edge e: region.allEdges(a)) {
          for (Edge treeEdge: region.memletTree(e)) {
            if (oldName.equals(treeEdge.getMemlet().getData())) {
              treeEdge.getMemlet().setData(newName);
            }
          }
        }
      }
    }
  }

  /**
   * Remove buffers no longer referenced by any access node or memlet
   * @return names of removed buffers
   */
  static Set<String> removeUnusedBuffers(Program program) {
    Set<String> used = new HashSet<String>();
    for (Region region: program.getRegions()) {
      used.addAll(region.accessedData());
      for (Edge e: region.edges()) {
        if (e.getMemlet().getData() != null) {
          used.add(e.getMemlet().getData());
        }
      }
    }
    Set<String> removed = new TreeSet<String>();
    for (String b: new ArrayList<String>(program.getBuffers().keySet())) {
      if (!used.contains(b)) {
        program.removeBuffer(b);
        removed.add(b);
      }
    }
    return removed;
  }

  static SymExpr transientBytes(Program program) {
    List<SymExpr> sizes = new ArrayList<SymExpr>();
    for (String t: program.transientNames()) {
      sizes.add(program.lookupBuffer(t).sizeInBytes());
    }
    return SymExpr.sum(sizes);
  }

  /**
   * Outcome of one run of the pass
   */
  public static class ReuseReport {
    private final SymExpr memoryBefore;
    private final SymExpr memoryAfter;
    private final List<List<String>> mergedBuckets;
    private final Map<String, String> renames;

    public ReuseReport(SymExpr memoryBefore, SymExpr memoryAfter,
                       List<List<String>> mergedBuckets,
                       Map<String, String> renames) {
      this.memoryBefore = memoryBefore;
      this.memoryAfter = memoryAfter;
      this.mergedBuckets = Collections.unmodifiableList(mergedBuckets);
      this.renames = Collections.unmodifiableMap(renames);
    }

    public SymExpr getMemoryBefore() {
      return memoryBefore;
    }

    public SymExpr getMemoryAfter() {
      return memoryAfter;
    }

    /** Buckets of two or more buffers that now share storage */
    public List<List<String>> getMergedBuckets() {
      return mergedBuckets;
    }

    /** Old buffer name to new buffer name */
    public Map<String, String> getRenames() {
      return renames;
    }

    public boolean changed() {
      return !renames.isEmpty();
    }
  }
}
