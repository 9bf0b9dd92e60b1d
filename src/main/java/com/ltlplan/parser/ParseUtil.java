package com.ltlplan.parser;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import javax.annotation.Nullable;

final class ParseUtil {
  private ParseUtil() {}

  static Stream<JsonElement> stream(@Nullable JsonArray array) {
    if (array == null || array.isEmpty()) {
      return Stream.of();
    }
    return StreamSupport.stream(Spliterators.spliterator(array.iterator(), array.size(),
        Spliterator.IMMUTABLE | Spliterator.SIZED | Spliterator.ORDERED), false);
  }

  static List<String> strings(@Nullable JsonArray array) {
    return stream(array).map(JsonElement::getAsString).map(String::strip).toList();
  }
}
