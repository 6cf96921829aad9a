package io.qzss.dcragent.testutil;

import io.qzss.dcragent.domain.report.Category;
import io.qzss.dcragent.domain.report.Report;
import java.time.Instant;
import java.util.List;

/** Report fixtures. */
public final class Reports {
  public static final Instant EVENT_TIME = Instant.parse("2024-01-01T07:10:00Z");

  private Reports() {}

  public static Report tsunami(String... regions) {
    return new Report(
        Category.TSUNAMI,
        EVENT_TIME,
        "津波警報",
        "津波警報\n発表時刻: 1日16時10分\n" + String.join(",", regions),
        1,
        false,
        null,
        List.of(regions));
  }

  public static Report training(Category category, String... localities) {
    return new Report(
        category,
        EVENT_TIME,
        "訓練",
        "訓練 訓練 訓練",
        Report.TRAINING_CLASSIFICATION,
        false,
        null,
        List.of(localities));
  }

  public static Report nankai(Boolean completed) {
    return new Report(
        Category.NANKAI_TROUGH_EARTHQUAKE,
        EVENT_TIME,
        "南海トラフ地震臨時情報",
        "南海トラフ地震臨時情報（調査中）",
        1,
        false,
        completed,
        List.of());
  }

  public static Report jAlert(boolean training) {
    return new Report(
        Category.J_ALERT, EVENT_TIME, "", "弾道ミサイル情報", 0, training, null, List.of("東京都"));
  }
}
