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
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

import com.google.common.collect.SetMultimap;

import exm.dcir.ir.tree.Program;

/**
 * Greedy grouping of buffers into chains that can share storage.
 */
public class ReuseBuckets {

  public static final String REUSE_BUFFER_NAME = "transient_reuse";

  /**
   * Place each candidate, in lexicographic order, into the first bucket
   * it can join:
   * - appended if every member may be replaced by it
   * - prepended if it may be replaced by every member
   * Otherwise it starts a new bucket.
   *
   * @param candidates buffer names
   * @param merges n -> m if n may be replaced by m
   * @return buckets in creation order, each ordered by lifetime
   */
  public static List<List<String>> assign(Collection<String> candidates,
                                   SetMultimap<String, String> merges) {
    List<List<String>> buckets = new ArrayList<List<String>>();
    for (String c: new TreeSet<String>(candidates)) {
      boolean placed = false;
      for (List<String> bucket: buckets) {
        if (allReplacedBy(bucket, c, merges)) {
          bucket.add(c);
          placed = true;
          break;
        } else if (replacesAll(c, bucket, merges)) {
          bucket.add(0, c);
          placed = true;
          break;
        }
      }
      if (!placed) {
        List<String> bucket = new ArrayList<String>();
        bucket.add(c);
        buckets.add(bucket);
      }
    }
    return buckets;
  }

  private static boolean allReplacedBy(List<String> bucket, String c,
                                   SetMultimap<String, String> merges) {
    for (String b: bucket) {
      if (!merges.containsEntry(b, c)) {
        return false;
      }
    }
    return true;
  }

  private static boolean replacesAll(String c, List<String> bucket,
                                   SetMultimap<String, String> merges) {
    for (String b: bucket) {
      if (!merges.containsEntry(c, b)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Declare one fresh transient buffer per bucket with more than one
   * member, cloned from the descriptor of its first member.
   * @return map of old buffer name to new buffer name
   */
  public static Map<String, String> synthesize(Program program,
                                        List<List<String>> buckets) {
    Map<String, String> renames = new TreeMap<String, String>();
    for (List<String> bucket: buckets) {
      if (bucket.size() < 2) {
        continue;
      }
      String newName = program.addBuffer(REUSE_BUFFER_NAME,
                program.lookupBuffer(bucket.get(0)).cloneDesc(), true);
      program.lookupBuffer(newName).setTransient(true);
      for (String old: bucket) {
        renames.put(old, newName);
      }
    }
    return renames;
  }
}
