package com.verlumen.bayesopt.cluster;

import com.google.common.collect.ImmutableList;
import com.verlumen.bayesopt.acquisition.LocalOptimum;
import com.verlumen.bayesopt.space.BoundsTable;
import java.util.List;
import java.util.Set;

/** Reduces the local optima of one acquisition search to a diversified evaluation batch. */
public interface CandidateClusterer {
  /**
   * @param bounds the search space
   * @param optima local optima of the latest acquisition search, in any order
   * @param batchSize exact number of candidates to return
   * @param settings retention threshold and noise width
   * @param evaluated raw vectors already scored; none of them is returned again
   * @return {@code batchSize} distinct candidates that have not been evaluated before
   */
  CandidateBatch select(
      BoundsTable bounds,
      List<LocalOptimum> optima,
      int batchSize,
      ClusterSettings settings,
      Set<ImmutableList<Double>> evaluated);
}
