package com.scholary.video2mp3.platform;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class PlatformDetectorTest {

  private final PlatformDetector detector = new PlatformDetector();

  @ParameterizedTest
  @CsvSource({
    "https://v.douyin.com/iRNBho6u/, DOUYIN",
    "https://www.iesdouyin.com/share/video/123, DOUYIN",
    "https://v.kuaishou.com/abc, KUAISHOU",
    "https://www.bilibili.com/video/BV1xx411c7mD, BILIBILI",
    "https://b23.tv/a1b2c3, BILIBILI",
    "http://xhslink.com/a/xyz, XIAOHONGSHU",
    "https://haokan.baidu.com/v?vid=1, HAOKAN",
    "https://isee.weishi.qq.com/ws/app-pages/share/index.html, WEISHI",
    "https://www.pearvideo.com/video_1790000, PEARVIDEO",
    "https://h5.pipigx.com/pp/post/123, PIPIGAOXIAO"
  })
  void detect_shouldClassifyKnownHosts(String url, Platform expected) {
    assertThat(detector.detect(url)).contains(expected);
  }

  @ParameterizedTest
  @ValueSource(strings = {"https://www.youtube.com/watch?v=x", "not a url", "", "mailto:a@b.c"})
  void detect_shouldReturnEmptyForUnsupportedInput(String url) {
    assertThat(detector.detect(url)).isEmpty();
  }

  @ParameterizedTest
  @ValueSource(strings = {"https://example.com/douyin/video/1"})
  void detect_shouldOnlyLookAtTheHost(String url) {
    assertThat(detector.detect(url)).isEmpty();
  }
}
