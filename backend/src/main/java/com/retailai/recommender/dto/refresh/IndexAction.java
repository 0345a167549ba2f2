package com.retailai.recommender.dto.refresh;

/** What a refresh cycle did to a modality's index. */
public enum IndexAction {
  NONE,
  INCREMENTAL_INSERT,
  FULL_BUILD
}
