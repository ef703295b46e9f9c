package com.github.behaviouractor.examples.chart;

import static java.util.Objects.requireNonNull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.behaviouractor.Actor;
import com.github.behaviouractor.ActorRef;
import com.github.behaviouractor.Receive;
import com.github.behaviouractor.dsl.Base;
import com.github.behaviouractor.dsl.Behaviours;
import com.github.behaviouractor.examples.chart.ChartProtocol.AddSeries;
import com.github.behaviouractor.examples.chart.ChartProtocol.ChartUpdate;
import com.github.behaviouractor.examples.chart.ChartProtocol.Metric;
import com.github.behaviouractor.examples.chart.ChartProtocol.RemoveSeries;
import com.github.behaviouractor.examples.chart.ChartProtocol.TogglePause;


/**
 * Collects metrics into a {@link ChartModel} and sends every change to the sink. While paused,
 * the incoming metrics are charted as zeros so the x axis keeps moving. Pause is stacked on top
 * of the charting behaviour and toggling it again brings charting back.
 */
public class ChartingActor extends Actor implements Base, Behaviours {

	private static final Logger LOG = LoggerFactory.getLogger(ChartingActor.class);

	public static final String CHARTING = "charting";
	public static final String PAUSED = "paused";

	private final ActorRef sink;
	private final ChartModel model;

	private final Receive paused = behaviour(PAUSED)
		.match(Metric.class, m -> append(m.getSeries(), 0))
		.matchEquals(TogglePause.INSTANCE, p -> resume())
		.build();

	public ChartingActor(final ActorRef sink, final int maxPoints) {
		this.sink = requireNonNull(sink, "Sink must not be null");
		this.model = new ChartModel(maxPoints);
	}

	@Override
	public Receive receive() {
		return behaviour(CHARTING)
			.match(AddSeries.class, this::onAddSeries)
			.match(RemoveSeries.class, this::onRemoveSeries)
			.match(Metric.class, m -> append(m.getSeries(), m.getValue()))
			.matchEquals(TogglePause.INSTANCE, p -> pause())
			.build();
	}

	private void onAddSeries(final AddSeries add) {
		if (model.addSeries(add.getName())) {
			update(add.getName());
		}
	}

	private void onRemoveSeries(final RemoveSeries remove) {
		if (model.removeSeries(remove.getName())) {
			update(remove.getName());
		}
	}

	private void append(final String series, final double value) {
		if (model.append(series, value)) {
			update(series);
		} else {
			LOG.debug("Metric for unknown series {} dropped", series);
		}
	}

	private void pause() {
		LOG.debug("Chart paused at x = {}", model.nextX());
		becomeStacked(paused);
	}

	private void resume() {
		LOG.debug("Chart resumed at x = {}", model.nextX());
		unbecome();
	}

	private void update(final String series) {
		tell(new ChartUpdate(series, model.points(series)), sink);
	}
}
