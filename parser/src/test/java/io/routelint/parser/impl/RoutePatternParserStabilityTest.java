package io.routelint.parser.impl;

import static org.junit.jupiter.api.Assertions.*;

import io.routelint.parser.api.RoutePatternParser;
import io.routelint.parser.api.RoutePatternTreeWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class RoutePatternParserStabilityTest {
  private static final List<String> PATTERNS =
      List.of(
          "",
          "api/{controller=Home}/{action=Index}/{id?}",
          "{ssn:regex(^\\d{{3}}-\\d{{2}}-\\d{{4}}$)}",
          "{*a}/{b}",
          "{a}{b}",
          "a{foob{bar}c",
          "{id:int:min(1)}/{**rest}",
          "{a:(x}",
          "}{{/{}");

  @Test
  void repeatedParsesProduceIdenticalTrees() {
    RoutePatternParser parser = RoutePatternParser.create();
    for (String pattern : PATTERNS) {
      assertEquals(
          RoutePatternTreeWriter.toText(parser.parse(pattern)),
          RoutePatternTreeWriter.toText(parser.parse(pattern)),
          pattern);
    }
  }

  @Test
  void sharedParserRunsInParallelThreads() throws Exception {
    RoutePatternParser parser = RoutePatternParser.create();
    List<String> expected = new ArrayList<>();
    for (String pattern : PATTERNS) {
      expected.add(RoutePatternTreeWriter.toText(parser.parse(pattern)));
    }

    int threads = 4;
    ExecutorService exec = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<List<String>>> results = new ArrayList<>();
    try {
      for (int t = 0; t < threads; t++) {
        results.add(
            exec.submit(
                () -> {
                  start.await();
                  List<String> texts = new ArrayList<>();
                  for (int round = 0; round < 50; round++) {
                    texts.clear();
                    for (String pattern : PATTERNS) {
                      texts.add(RoutePatternTreeWriter.toText(parser.parse(pattern)));
                    }
                  }
                  return texts;
                }));
      }
      start.countDown();
      for (Future<List<String>> result : results) {
        assertEquals(expected, result.get(10, TimeUnit.SECONDS));
      }
    } finally {
      exec.shutdownNow();
    }
  }
}
