package com.rms.fanout.web;

import com.rms.fanout.core.model.DomainEvent;
import com.rms.fanout.core.model.EventTopic;
import com.rms.fanout.core.store.RecipientKey;
import com.rms.fanout.subscription.EventSubscriptionService;
import com.rms.fanout.subscription.SubscriptionProperties;
import com.rms.fanout.subscription.SubscriptionRequest;
import jakarta.validation.constraints.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.time.Duration;

/**
 * Server-Sent-Event endpoints over {@link EventSubscriptionService}.
 *
 * <h2>Routes</h2>
 * <pre>
 * /sse/{recipient}                                          all topics, no deadline
 * /sse/{recipient}/{topic}                                  one topic, no deadline
 * /sse/{recipient}/{topic}/{desiredState}                   first event in that state
 * /sse/{recipient}/{topic}/{field}/{fieldId}                events whose payload[field] == fieldId
 * /sse/{recipient}/{topic}/{field}/{fieldId}/{desiredState} first such event in that state
 * </pre>
 * Every route accepts {@code lookback} (seconds, or a shorthand like {@code 90s}) and {@code group_id}.
 * Filtered routes end after the default subscription timeout.
 *
 * <p>Each event is sent as one {@code data:} line of JSON. A client disconnect cancels the flux, which
 * stops the subscription's populate task.</p>
 */
@RestController
@RequestMapping(path = "/sse", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
@Validated
public class SseController {

	private static final Logger log = LoggerFactory.getLogger(SseController.class);

	/**
	 * Ids end up in store keys and notification messages, both ':'-delimited.
	 */
	private static final String ID_PATTERN = RecipientKey.ID_PATTERN;

	private final EventSubscriptionService subscriptions;
	private final SubscriptionProperties props;

	public SseController(EventSubscriptionService subscriptions, SubscriptionProperties props) {
		this.subscriptions = subscriptions;
		this.props = props;
	}

	@GetMapping("/{recipientId}")
	public Flux<ServerSentEvent<DomainEvent>> recipient(
			@PathVariable @Pattern(regexp = ID_PATTERN) String recipientId,
			@RequestParam(name = "lookback", required = false) String lookback,
			@RequestParam(name = "group_id", required = false) @Pattern(regexp = ID_PATTERN) String groupId) {

		return open(base(recipientId, EventTopic.ALL, lookback, groupId).timeout(Duration.ZERO));
	}

	@GetMapping("/{recipientId}/{topic}")
	public Flux<ServerSentEvent<DomainEvent>> topic(
			@PathVariable @Pattern(regexp = ID_PATTERN) String recipientId,
			@PathVariable String topic,
			@RequestParam(name = "lookback", required = false) String lookback,
			@RequestParam(name = "group_id", required = false) @Pattern(regexp = ID_PATTERN) String groupId) {

		return open(base(recipientId, topic, lookback, groupId).timeout(Duration.ZERO));
	}

	@GetMapping("/{recipientId}/{topic}/{desiredState}")
	public Flux<ServerSentEvent<DomainEvent>> desiredState(
			@PathVariable @Pattern(regexp = ID_PATTERN) String recipientId,
			@PathVariable String topic,
			@PathVariable String desiredState,
			@RequestParam(name = "lookback", required = false) String lookback,
			@RequestParam(name = "group_id", required = false) @Pattern(regexp = ID_PATTERN) String groupId) {

		return open(base(recipientId, topic, lookback, groupId).desiredState(desiredState));
	}

	@GetMapping("/{recipientId}/{topic}/{field}/{fieldId}")
	public Flux<ServerSentEvent<DomainEvent>> field(
			@PathVariable @Pattern(regexp = ID_PATTERN) String recipientId,
			@PathVariable String topic,
			@PathVariable String field,
			@PathVariable String fieldId,
			@RequestParam(name = "lookback", required = false) String lookback,
			@RequestParam(name = "group_id", required = false) @Pattern(regexp = ID_PATTERN) String groupId) {

		return open(base(recipientId, topic, lookback, groupId).field(field, fieldId));
	}

	@GetMapping("/{recipientId}/{topic}/{field}/{fieldId}/{desiredState}")
	public Flux<ServerSentEvent<DomainEvent>> fieldAndState(
			@PathVariable @Pattern(regexp = ID_PATTERN) String recipientId,
			@PathVariable String topic,
			@PathVariable String field,
			@PathVariable String fieldId,
			@PathVariable String desiredState,
			@RequestParam(name = "lookback", required = false) String lookback,
			@RequestParam(name = "group_id", required = false) @Pattern(regexp = ID_PATTERN) String groupId) {

		return open(base(recipientId, topic, lookback, groupId)
				.field(field, fieldId)
				.desiredState(desiredState));
	}

	private SubscriptionRequest.Builder base(String recipientId, String topic, String lookback, String groupId) {
		return SubscriptionRequest.builder(recipientId)
				.topic(topic)
				.groupId(groupId)
				.lookback(DurationParam.parse(lookback, props.getDefaultLookback()))
				.timeout(props.getDefaultTimeout());
	}

	private Flux<ServerSentEvent<DomainEvent>> open(SubscriptionRequest.Builder builder) {
		SubscriptionRequest request = builder.build();
		log.info("SSE subscribe recipient={} topic={} group={} field={} state={} lookback={} timeout={}",
				request.recipientId(), request.topic(), request.groupId(), request.field(),
				request.desiredState(), request.lookback(), request.timeout());

		return subscriptions.subscribe(request)
				.map(event -> ServerSentEvent.builder(event).build())
				.doOnCancel(() -> log.debug("SSE client disconnected recipient={} topic={}",
						request.recipientId(), request.topic()));
	}
}
