package com.retailai.recommender.service.quality;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.stereotype.Repository;

import com.retailai.recommender.dto.quality.QualityAlert;

@Repository
public class InMemoryQualityAlertRepository implements QualityAlertRepository {

  private final AtomicReference<Map<String, QualityAlert>> alerts =
      new AtomicReference<>(Map.of());

  @Override
  public void replaceAll(Collection<QualityAlert> newAlerts) {
    Map<String, QualityAlert> byItem = new LinkedHashMap<>();
    for (QualityAlert alert : newAlerts) {
      byItem.put(alert.getItemId(), alert);
    }
    alerts.set(Map.copyOf(byItem));
  }

  @Override
  public List<QualityAlert> findAll() {
    return new ArrayList<>(alerts.get().values());
  }

  @Override
  public Optional<QualityAlert> findByItemId(String itemId) {
    return Optional.ofNullable(alerts.get().get(itemId));
  }
}
