package com.verlumen.curvestream.checkpoint;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import java.nio.file.Path;
import java.util.Optional;

@AutoValue
public abstract class CheckpointModule extends AbstractModule {
  public static CheckpointModule create(Optional<Path> checkpointFile) {
    return new AutoValue_CheckpointModule(checkpointFile);
  }

  abstract Optional<Path> checkpointFile();

  @Provides
  @Singleton
  CheckpointStore provideCheckpointStore() {
    if (checkpointFile().isEmpty()) {
      return new NoOpCheckpointStore();
    }
    return FileCheckpointStore.open(checkpointFile().get());
  }
}
