package com.github.behaviouractor;

import static java.util.Arrays.stream;
import static java.util.stream.Stream.concat;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Stream;

import com.github.behaviouractor.EventBus.Event;
import com.github.behaviouractor.EventBus.Subscribe;
import com.github.behaviouractor.EventBus.SubscribeAck;
import com.github.behaviouractor.EventBus.Unsubscribe;
import com.github.behaviouractor.EventBus.UnsubscribeAck;
import com.github.behaviouractor.dsl.Base;

import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;


/**
 * Messages understood by the event bus actor. Events are delivered to subscribers of the event
 * class and of all its superclasses and interfaces.
 */
public interface EventBus {

	class Subscribe {

		final Class<?> type;
		final ActorRef subscriber;

		public Subscribe(final Class<?> type, final ActorRef subscriber) {
			this.type = type;
			this.subscriber = subscriber;
		}

		public Class<?> getEventType() {
			return type;
		}

		public ActorRef getSubscriber() {
			return subscriber;
		}
	}

	class SubscribeAck {

		final Subscribe subscribe;

		public SubscribeAck(final Subscribe subscribe) {
			this.subscribe = subscribe;
		}

		public Subscribe getSubscribe() {
			return subscribe;
		}
	}

	class Unsubscribe {

		final Class<?> type;
		final ActorRef subscriber;

		public Unsubscribe(final Class<?> type, final ActorRef subscriber) {
			this.type = type;
			this.subscriber = subscriber;
		}

		public Class<?> getEventType() {
			return type;
		}

		public ActorRef getSubscriber() {
			return subscriber;
		}
	}

	class UnsubscribeAck {

		final Unsubscribe unsubscribe;

		public UnsubscribeAck(final Unsubscribe unsubscribe) {
			this.unsubscribe = unsubscribe;
		}

		public Unsubscribe getUnsubscribe() {
			return unsubscribe;
		}
	}

	class Event {

		final Object value;
		final ActorRef emitter;

		public Event(final Object value, final ActorRef emitter) {
			this.value = value;
			this.emitter = emitter;
		}
	}
}

class EventBusActor extends Actor implements Base {

	private final Long2ObjectOpenHashMap<ActorRef> noSubscription = new Long2ObjectOpenHashMap<>(0);
	private final Function<Class<?>, Long2ObjectOpenHashMap<ActorRef>> newSubscribersMap = $ -> new Long2ObjectOpenHashMap<>();
	private final Map<Class<?>, Long2ObjectOpenHashMap<ActorRef>> subscriptions = new HashMap<>();

	@Override
	public Receive receive() {
		return behaviour("event-bus")
			.match(Subscribe.class, this::onSubscribe)
			.match(Unsubscribe.class, this::onUnsubscribe)
			.match(Event.class, this::onEvent)
			.build();
	}

	void onSubscribe(final Subscribe subscribe) {

		final var subscriber = subscribe.subscriber;

		subscription(subscribe.type).put(subscriber.uuid, subscriber);

		tell(new SubscribeAck(subscribe), subscriber);
	}

	void onUnsubscribe(final Unsubscribe unsubscribe) {

		final var subscriber = unsubscribe.subscriber;
		final var subscribers = subscriptions.get(unsubscribe.type);

		if (subscribers != null) {
			subscribers.remove(subscriber.uuid);
		}

		tell(new UnsubscribeAck(unsubscribe), subscriber);
	}

	void onEvent(final Event event) {
		ascendantsOf(event.value.getClass())
			.distinct()
			.forEach(checkIfSubscribedAndSend(event));
	}

	private Consumer<Class<?>> checkIfSubscribedAndSend(final Event event) {
		return clazz -> subscriptions
			.getOrDefault(clazz, noSubscription)
			.values()
			.forEach(subscriber -> subscriber.tell(event.value, event.emitter));
	}

	private Long2ObjectOpenHashMap<ActorRef> subscription(final Class<?> type) {
		return subscriptions.computeIfAbsent(type, newSubscribersMap);
	}

	private Stream<Class<?>> ascendantsOf(final Class<?> clazz) {

		if (clazz == null) {
			return Stream.empty();
		}

		final var superclass = concat(Stream.of(clazz), ascendantsOf(clazz.getSuperclass()));
		final var interfaces = stream(clazz.getInterfaces()).flatMap(this::ascendantsOf);

		return concat(superclass, interfaces);
	}
}
