package com.retailai.recommender.service.quality;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import com.retailai.recommender.dto.quality.QualityAlert;

/** Latest alert per item. */
public interface QualityAlertRepository {

  /**
   * Replaces the whole table in one step. Readers see either the previous set or the new one.
   *
   * @param alerts the complete new set of alerts
   */
  void replaceAll(Collection<QualityAlert> alerts);

  List<QualityAlert> findAll();

  Optional<QualityAlert> findByItemId(String itemId);
}
