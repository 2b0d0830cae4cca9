package com.scholary.video2mp3.platform;

import java.util.List;
import java.util.Locale;

/** Short-video platforms the converter accepts, matched by host substrings. */
public enum Platform {
  DOUYIN("douyin", List.of("douyin", "iesdouyin")),
  KUAISHOU("kuaishou", List.of("kuaishou", "kwai")),
  BILIBILI("bilibili", List.of("bilibili", "b23.tv")),
  XIAOHONGSHU("xiaohongshu", List.of("xiaohongshu", "xhslink")),
  HAOKAN("haokan", List.of("haokan.baidu.com", "haokan.hao123.com")),
  WEISHI("weishi", List.of("weishi.qq.com", "isee.weishi")),
  PEARVIDEO("pearvideo", List.of("pearvideo")),
  PIPIGAOXIAO("pipigaoxiao", List.of("pipigx"));

  private final String tag;
  private final List<String> hostMarkers;

  Platform(String tag, List<String> hostMarkers) {
    this.tag = tag;
    this.hostMarkers = hostMarkers;
  }

  public String tag() {
    return tag;
  }

  boolean matchesHost(String host) {
    String lower = host.toLowerCase(Locale.ROOT);
    return hostMarkers.stream().anyMatch(lower::contains);
  }
}
