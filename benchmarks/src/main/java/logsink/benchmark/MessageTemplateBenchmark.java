package logsink.benchmark;

import logsink.codec.MessageTemplate;
import org.openjdk.jmh.annotations.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Measures template rendering with a warm parse cache.
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 2)
@Measurement(iterations = 5, time = 3)
@Fork(1)
public class MessageTemplateBenchmark {

  @Param({
      "User {Name} logged in",
      "Order {OrderId} shipped to {City} at {When:HH:mm:ss} ({Weight:0.00} kg)"
  })
  private String template;

  private Map<String, Object> parameters;

  @Setup(Level.Trial)
  public void setup() {
    parameters = new LinkedHashMap<>();
    parameters.put("Name", "alice");
    parameters.put("OrderId", 1042);
    parameters.put("City", "Oslo");
    parameters.put("When", Instant.parse("2024-05-01T10:15:30Z"));
    parameters.put("Weight", 12.5);
  }

  @Benchmark
  public String render() {
    return MessageTemplate.format(template, parameters);
  }
}
