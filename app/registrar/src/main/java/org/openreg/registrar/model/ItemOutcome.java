package org.openreg.registrar.model;

/** 書き込みジョブの項目単位の結果分類。 */
public enum ItemOutcome {
  SUCCESS,
  DUPLICATE,
  VALIDATION_ERROR,
  INTERNAL_ERROR
}
