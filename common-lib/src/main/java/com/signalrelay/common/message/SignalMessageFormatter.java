package com.signalrelay.common.message;

import com.signalrelay.common.model.Signal;

import java.util.Locale;

/**
 * Builds the HTML notification text relayed when the caller sent none.
 *
 * <p>Numbers are rendered with {@link Double#toString(double)} so the text carries exactly
 * the values present in the forwarded payload.
 */
public final class SignalMessageFormatter {

    public static final String BUY_MARKER  = "🟢";
    public static final String SELL_MARKER = "🔴";

    private SignalMessageFormatter() {}

    public static String format(Signal signal) {
        StringBuilder sb = new StringBuilder();
        sb.append(directionMarker(signal.action())).append(" <b>SIGNAL RECEIVED</b>\n");
        sb.append("<b>Ticker:</b> ").append(signal.ticker()).append('\n');
        sb.append("<b>Action:</b> ").append(signal.action()).append('\n');
        sb.append("<b>Price:</b> ").append(signal.price()).append('\n');
        sb.append("<b>TP1:</b> ").append(signal.tp1())
          .append(" | <b>TP2:</b> ").append(signal.tp2())
          .append(" | <b>TP3:</b> ").append(signal.tp3()).append('\n');
        sb.append("<b>SL:</b> ").append(signal.sl());
        return sb.toString();
    }

    /** Green for anything containing "buy", red otherwise. */
    public static String directionMarker(String action) {
        return action != null && action.toLowerCase(Locale.ROOT).contains("buy") ? BUY_MARKER : SELL_MARKER;
    }
}
