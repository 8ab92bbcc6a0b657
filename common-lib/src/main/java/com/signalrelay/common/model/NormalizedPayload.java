package com.signalrelay.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalrelay.common.message.SignalMessageFormatter;
import com.signalrelay.common.parse.SignalParser;

/**
 * Body POSTed to every sink: the signal's fields plus a resolved routing target and message.
 */
public record NormalizedPayload(
    @JsonProperty("action")  String action,
    @JsonProperty("ticker")  String ticker,
    @JsonProperty("price")   double price,
    @JsonProperty("sl")      double sl,
    @JsonProperty("tp1")     double tp1,
    @JsonProperty("tp2")     double tp2,
    @JsonProperty("tp3")     double tp3,
    @JsonProperty("result")  String result,
    @JsonProperty("comment") String comment,
    @JsonProperty("date")    String date,
    @JsonProperty("time")    String time,
    @JsonProperty("chat_id") String chatId,
    @JsonProperty("text")    String text
) {
    /**
     * @param defaultChatId routing target used when the caller did not supply one
     */
    public static NormalizedPayload of(Signal signal, String defaultChatId) {
        String chatId = isBlank(signal.chatId()) ? defaultChatId : signal.chatId();
        String text = isBlank(signal.text()) ? SignalMessageFormatter.format(signal) : signal.text();
        return new NormalizedPayload(
            signal.action(), signal.ticker(), signal.price(),
            signal.sl(), signal.tp1(), signal.tp2(), signal.tp3(),
            signal.result(), signal.comment(),
            SignalParser.DATE_FORMAT.format(signal.date()),
            SignalParser.TIME_FORMAT.format(signal.time()),
            chatId, text);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
