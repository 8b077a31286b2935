package com.verlumen.curvestream.events;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.Bind;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.curvestream.filters.AttributeFilter;
import com.verlumen.curvestream.filters.FilterValidationException;
import com.verlumen.curvestream.filters.NameFilter;
import com.verlumen.curvestream.model.EventType;
import com.verlumen.curvestream.model.SequenceId;
import java.util.Optional;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class SubscriptionControllerTest {
  @Rule public MockitoRule mocks = MockitoJUnit.rule();

  @Mock @Bind private MessageSender mockSender;

  @Inject private SubscriptionController controller;
  @Inject private Subscription subscription;
  @Inject private Watermark watermark;

  @Before
  public void setUp() {
    Guice.createInjector(BoundFieldModule.of(this)).injectMembers(this);
  }

  @Test
  public void subscribe_sendsFilterSetAndRemembersIt() {
    AttributeFilter filter =
        AttributeFilter.builder().setAreas("DE").setEventTypes(EventType.UPDATE).build();

    controller.subscribe(ImmutableList.of(filter), Optional.of("req-1"), false);

    ArgumentCaptor<String> sent = ArgumentCaptor.forClass(String.class);
    verify(mockSender).send(sent.capture());
    JsonObject message = JsonParser.parseString(sent.getValue()).getAsJsonObject();
    assertThat(message.get("type").getAsString()).isEqualTo("filter.set");
    assertThat(message.get("id").getAsString()).isEqualTo("req-1");
    assertThat(message.has("last_id")).isFalse();
    assertThat(message.getAsJsonArray("filters").get(0)).isEqualTo(filter.toJson());
    assertThat(subscription.latest()).hasValue(sent.getValue());
  }

  @Test
  public void subscribe_fillResumeId_addsLastDeliveredId() {
    watermark.advance(SequenceId.parse("1700000000000-7"));

    controller.subscribe(
        ImmutableList.of(NameFilter.builder().setCurveNames("DE Price").build()),
        Optional.empty(),
        true);

    ArgumentCaptor<String> sent = ArgumentCaptor.forClass(String.class);
    verify(mockSender).send(sent.capture());
    JsonObject message = JsonParser.parseString(sent.getValue()).getAsJsonObject();
    assertThat(message.get("last_id").getAsString()).isEqualTo("1700000000000-7");
    assertThat(message.has("id")).isFalse();
  }

  @Test
  public void subscribe_fillResumeIdWithoutWatermark_omitsLastId() {
    controller.subscribe(
        ImmutableList.of(AttributeFilter.builder().setAreas("FR").build()), Optional.empty(), true);

    ArgumentCaptor<String> sent = ArgumentCaptor.forClass(String.class);
    verify(mockSender).send(sent.capture());
    assertThat(sent.getValue()).doesNotContain("last_id");
  }

  @Test
  public void subscribe_invalidFilters_throwsWithoutSending() {
    ImmutableList<AttributeFilter> filters = ImmutableList.of(
        AttributeFilter.builder().setBegin("tomorrow").setEventTypes("CURVE_UPSERT").build());

    FilterValidationException thrown = assertThrows(
        FilterValidationException.class,
        () -> controller.subscribe(filters, Optional.empty(), false));

    assertThat(thrown.violations()).hasSize(2);
    verifyNoInteractions(mockSender);
    assertThat(subscription.latest()).isEmpty();
  }

  @Test
  public void subscribe_notConnected_failsFast() {
    doThrow(new IllegalStateException("Not connected")).when(mockSender).send(anyString());

    assertThrows(
        IllegalStateException.class,
        () -> controller.subscribe(
            ImmutableList.of(AttributeFilter.builder().setAreas("DE").build()),
            Optional.empty(),
            false));
  }

  @Test
  public void requestActiveFilters_sendsFilterGet() {
    controller.requestActiveFilters(Optional.of("abc"));

    verify(mockSender).send("{\"type\":\"filter.get\",\"id\":\"abc\"}");
  }

  @Test
  public void requestActiveFilters_withoutId() {
    controller.requestActiveFilters(Optional.empty());

    verify(mockSender).send("{\"type\":\"filter.get\"}");
  }
}
