/*
 * Copyright 2020 The Closure Compiler Authors.
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
 * limitations under the License.
 */

package com.google.tensorexpr.ir;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Computes structural hashes of expressions: structurally identical trees hash
 * equal, whatever their identity. Hashes are cached per node, so a provider
 * should live no longer than the rewrite that uses it.
 *
 * <p>This class is not thread safe.
 */
public final class HashProvider {

  private static final HashFunction HASH_FUNCTION = Hashing.murmur3_128();

  private final Map<Expr, ExprHash> cache = new IdentityHashMap<>();

  public ExprHash hash(Expr e) {
    ExprHash cached = cache.get(e);
    if (cached != null) {
      return cached;
    }
    Hasher hasher = HASH_FUNCTION.newHasher();
    hasher.putString(e.getKind().name(), UTF_8);
    hasher.putInt(e.getDtype().getScalarType().ordinal());
    hasher.putInt(e.getDtype().getLanes());
    switch (e.getKind()) {
      case IMMEDIATE:
        hasher.putLong(((Immediate) e).getBits());
        break;
      case VAR:
        hasher.putString(((Var) e).getName(), UTF_8);
        break;
      case MAX:
      case MIN:
        hasher.putBoolean(((BinaryOp) e).propagatesNans());
        break;
      case COMPARE_SELECT:
        hasher.putInt(((CompareSelect) e).getCompareOp().ordinal());
        break;
      case INTRINSICS:
        hasher.putString(((Intrinsics) e).getOp().name(), UTF_8);
        break;
      default:
        break;
    }
    for (Expr child : e.getChildren()) {
      hasher.putLong(hash(child).asLong());
    }
    ExprHash result = new ExprHash(hasher.hash().asLong());
    cache.put(e, result);
    return result;
  }

  /** Combines a sequence of hashes, in order, into one. */
  public ExprHash hashCombine(Iterable<ExprHash> hashes) {
    Hasher hasher = HASH_FUNCTION.newHasher();
    for (ExprHash hash : hashes) {
      hasher.putLong(hash.asLong());
    }
    return new ExprHash(hasher.hash().asLong());
  }
}
