// Copyright 2026 The Name Registry Authors. All Rights Reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package nameregistry.persistence;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static org.joda.time.DateTimeZone.UTC;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.flogger.FluentLogger;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.TreeMap;
import org.joda.time.DateTime;

/**
 * A {@link KeyValueStore} kept in memory and mirrored to a JSON file after every write.
 *
 * <p>The whole map is rewritten on each change, first to a sibling temporary file which is then
 * atomically moved over the previous version, so a crash leaves either the old or the new contents
 * on disk. A write that cannot be flushed is undone in memory before the error is rethrown.
 */
public class JsonFileKeyValueStore<V> implements KeyValueStore<V> {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final Gson GSON =
      new GsonBuilder()
          .registerTypeAdapter(DateTime.class, new DateTimeTypeAdapter().nullSafe())
          .registerTypeHierarchyAdapter(ImmutableList.class, immutableListDeserializer())
          .create();

  private final Path file;
  private final Type mapType;
  private final TreeMap<String, V> entries;

  public JsonFileKeyValueStore(Path file, Type valueType) {
    this.file = checkNotNull(file, "file");
    this.mapType = TypeToken.getParameterized(TreeMap.class, String.class, valueType).getType();
    this.entries = load();
  }

  @Override
  public synchronized Optional<V> get(String key) {
    return Optional.ofNullable(entries.get(checkNotNull(key, "key")));
  }

  @Override
  public synchronized void put(String key, V value) {
    checkNotNull(value, "value");
    V previous = entries.put(checkNotNull(key, "key"), value);
    try {
      flush();
    } catch (UncheckedIOException e) {
      restore(key, previous);
      throw e;
    }
  }

  @Override
  public synchronized void remove(String key) {
    V previous = entries.remove(checkNotNull(key, "key"));
    if (previous == null) {
      return;
    }
    try {
      flush();
    } catch (UncheckedIOException e) {
      restore(key, previous);
      throw e;
    }
  }

  @Override
  public synchronized ImmutableSortedMap<String, V> entries() {
    return ImmutableSortedMap.copyOfSorted(entries);
  }

  private void restore(String key, V previous) {
    if (previous == null) {
      entries.remove(key);
    } else {
      entries.put(key, previous);
    }
  }

  private TreeMap<String, V> load() {
    if (!Files.exists(file)) {
      logger.atInfo().log("No existing store at %s; starting empty.", file);
      return new TreeMap<>();
    }
    try {
      TreeMap<String, V> loaded = GSON.fromJson(Files.readString(file, UTF_8), mapType);
      logger.atInfo().log("Loaded %d entries from %s.", loaded == null ? 0 : loaded.size(), file);
      return loaded == null ? new TreeMap<>() : loaded;
    } catch (IOException e) {
      throw new UncheckedIOException(String.format("Could not read store file %s", file), e);
    }
  }

  private void flush() {
    Path temporaryFile = file.resolveSibling(file.getFileName() + ".tmp");
    try {
      if (file.getParent() != null) {
        Files.createDirectories(file.getParent());
      }
      Files.writeString(temporaryFile, GSON.toJson(entries, mapType), UTF_8);
      Files.move(temporaryFile, file, REPLACE_EXISTING, ATOMIC_MOVE);
    } catch (IOException e) {
      throw new UncheckedIOException(String.format("Could not write store file %s", file), e);
    }
  }

  /** Stores {@link DateTime}s as epoch milliseconds, read back in UTC. */
  private static final class DateTimeTypeAdapter extends TypeAdapter<DateTime> {
    @Override
    public void write(JsonWriter out, DateTime value) throws IOException {
      out.value(value.getMillis());
    }

    @Override
    public DateTime read(JsonReader in) throws IOException {
      return new DateTime(in.nextLong(), UTC);
    }
  }

  private static JsonDeserializer<ImmutableList<?>> immutableListDeserializer() {
    return (json, typeOfT, context) -> {
      if (!(typeOfT instanceof ParameterizedType parameterizedType)) {
        throw new JsonParseException("Raw ImmutableList cannot be deserialized: " + typeOfT);
      }
      Type elementType = parameterizedType.getActualTypeArguments()[0];
      ImmutableList.Builder<Object> builder = ImmutableList.builder();
      for (JsonElement element : json.getAsJsonArray()) {
        builder.add((Object) context.deserialize(element, elementType));
      }
      return builder.build();
    };
  }
}
