/*
 * どこで: Registrar モデル
 * 何を: 組織を表す
 * なぜ: 権限スコープの最上位として扱うため
 */
package org.openreg.registrar.model;

import java.util.UUID;

public record Organization(long id, String key, UUID uuid, String name) {}
