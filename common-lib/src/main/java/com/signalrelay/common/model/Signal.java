package com.signalrelay.common.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * One validated inbound event. Built only by {@link com.signalrelay.common.parse.SignalParser},
 * so {@code action} and {@code ticker} are non-blank, every number is finite and
 * {@code date}/{@code time} are always set.
 */
public record Signal(
    @JsonProperty("action")  String action,
    @JsonProperty("ticker")  String ticker,
    @JsonProperty("price")   double price,
    @JsonProperty("sl")      double sl,
    @JsonProperty("tp1")     double tp1,
    @JsonProperty("tp2")     double tp2,
    @JsonProperty("tp3")     double tp3,
    @JsonProperty("result")  String result,
    @JsonProperty("comment") String comment,
    @JsonProperty("chat_id") String chatId,
    @JsonProperty("text")    String text,
    @JsonProperty("date") @JsonFormat(pattern = "yyyy-MM-dd") LocalDate date,
    @JsonProperty("time") @JsonFormat(pattern = "HH:mm:ss")   LocalTime time
) {}
