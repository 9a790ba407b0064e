/*
 * どこで: Registrar ジョブモデル
 * 何を: 登録書き込みジョブの入力 1 件を表す
 * なぜ: 下流 LMS へ送る単位と結果集計の単位を揃えるため
 */
package org.openreg.registrar.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EnrollmentItem(String studentKey, String status) {}
