package io.intellixity.relata.persistence.mongo;

import io.intellixity.relata.persistence.spi.sql.NativeStatement;
import org.bson.Document;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** Aggregation pipeline run against the root collection. */
public record MongoStatement(String collection, List<Document> pipeline) implements NativeStatement {
  public MongoStatement {
    Objects.requireNonNull(collection, "collection");
    pipeline = List.copyOf(pipeline == null ? List.of() : pipeline);
  }

  /** Names of the pipeline stages, in order. */
  public List<String> stageNames() {
    return pipeline.stream().map(d -> d.keySet().iterator().next()).collect(Collectors.toList());
  }

  @Override
  public String describe() {
    return collection + ".aggregate(["
        + pipeline.stream().map(Document::toJson).collect(Collectors.joining(", ")) + "])";
  }
}
