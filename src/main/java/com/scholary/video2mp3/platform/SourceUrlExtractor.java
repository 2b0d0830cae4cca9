package com.scholary.video2mp3.platform;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Pulls the first http(s) link out of pasted share text.
 *
 * <p>Share sheets wrap the link in prose ("Check this out! https://v.douyin.com/abc/ copy and
 * open..."), so the submitted value is scanned rather than parsed as a whole.
 */
@Component
public class SourceUrlExtractor {

  private static final Pattern URL_PATTERN = Pattern.compile("https?://\\S+");
  private static final String TRAILING_PUNCTUATION = ".,;:!?)\"'";

  public Optional<String> extract(String input) {
    if (input == null) {
      return Optional.empty();
    }
    Matcher matcher = URL_PATTERN.matcher(input.trim());
    if (!matcher.find()) {
      return Optional.empty();
    }
    String match = matcher.group();
    int end = match.length();
    while (end > 0 && TRAILING_PUNCTUATION.indexOf(match.charAt(end - 1)) >= 0) {
      end--;
    }
    String url = match.substring(0, end);
    return url.isEmpty() ? Optional.empty() : Optional.of(url);
  }
}
