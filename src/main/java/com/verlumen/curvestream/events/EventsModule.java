package com.verlumen.curvestream.events;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.verlumen.curvestream.checkpoint.CheckpointModule;
import com.verlumen.curvestream.http.HttpModule;

@AutoValue
public abstract class EventsModule extends AbstractModule {
  public static EventsModule create(EventStreamConfig config) {
    return new AutoValue_EventsModule(config);
  }

  abstract EventStreamConfig config();

  @Override
  protected void configure() {
    bind(EventStreamConfig.class).toInstance(config());
    bind(ConnectionStatus.class).to(ConnectionSupervisor.class);
    bind(MessageSender.class).to(ConnectionSupervisor.class);
    bind(EventStreamClient.class).to(EventStreamClientImpl.class);

    install(CheckpointModule.create(config().checkpointFile()));
    install(HttpModule.create());
  }
}
