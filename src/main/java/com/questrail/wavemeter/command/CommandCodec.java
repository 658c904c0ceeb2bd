package com.questrail.wavemeter.command;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.api.Quantity;

import java.util.Objects;

/**
 * CommandCodec
 * -----------------------------------------------------------------------------
 * JSON encoding of the command protocol.
 *
 * <h2>Request</h2>
 * <pre>
 *   {"action":"PROGRAM_VALUE","connection":3,"quantity":"Setpoint","value":348.66641,"wait":true}
 * </pre>
 * <ul>
 *   <li>{@code action} - required, one of {@link CommandAction}</li>
 *   <li>{@code connection} - channel number, integer or numeric string; read
 *       only for CHECK_VALUE and PROGRAM_VALUE</li>
 *   <li>{@code quantity} - optional wire or constant name, default {@code Setpoint}</li>
 *   <li>{@code value} - number or numeric string (comma decimal separator accepted)</li>
 *   <li>{@code wait} - optional boolean, default {@code false}</li>
 * </ul>
 *
 * <h2>Response</h2>
 * <pre>
 *   {"status":"SUCCESS","result":"QUEUED"}
 *   {"status":"SUCCESS","value":348.66641}
 *   {"status":"TIMEOUT","message":"..."}
 * </pre>
 */
public final class CommandCodec
{
    private final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    public CommandRequest decode(String line) throws CommandFormatException {
        Objects.requireNonNull(line, "line");
        JsonObject obj;
        try {
            JsonElement root = JsonParser.parseString(line);
            if (!root.isJsonObject()) {
                throw new CommandFormatException("Request must be a JSON object");
            }
            obj = root.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new CommandFormatException("Malformed JSON: " + e.getMessage(), e);
        }

        String actionName = string(obj, "action");
        if (actionName == null) {
            throw new CommandFormatException("Missing action");
        }
        CommandAction action = CommandAction.fromWire(actionName)
                .orElseThrow(() -> new CommandFormatException("Unknown action: " + actionName));
        if (action == CommandAction.HELLO) {
            // Other fields are ignored, whatever they hold.
            return CommandRequest.hello();
        }

        Quantity quantity = Quantity.SETPOINT;
        String quantityName = string(obj, "quantity");
        if (quantityName != null) {
            quantity = Quantity.fromName(quantityName)
                    .orElseThrow(() -> new CommandFormatException("Unknown quantity: " + quantityName));
        }

        ChannelId channel = channel(obj);
        Double value = number(obj, "value");
        boolean wait = bool(obj, "wait");
        return new CommandRequest(action, channel, quantity, value, wait);
    }

    public String encode(CommandResponse response) {
        Objects.requireNonNull(response, "response");
        JsonObject obj = new JsonObject();
        obj.addProperty("status", response.status().name());
        if (response.result() != null) {
            obj.addProperty("result", response.result());
        }
        if (response.value() != null) {
            obj.addProperty("value", response.value());
        }
        if (response.message() != null) {
            obj.addProperty("message", response.message());
        }
        return gson.toJson(obj);
    }

    private static String string(JsonObject obj, String field) throws CommandFormatException {
        JsonElement e = obj.get(field);
        if (e == null || e.isJsonNull()) {
            return null;
        }
        if (!e.isJsonPrimitive()) {
            throw new CommandFormatException("Field " + field + " must be a string");
        }
        return e.getAsString();
    }

    private static ChannelId channel(JsonObject obj) throws CommandFormatException {
        Double raw = number(obj, "connection");
        if (raw == null) {
            return null;
        }
        if (raw != Math.rint(raw)) {
            throw new CommandFormatException("connection must be an integer channel number (was " + raw + ")");
        }
        try {
            return ChannelId.of(raw.intValue());
        } catch (IllegalArgumentException e) {
            throw new CommandFormatException("Unknown channel: " + raw.intValue(), e);
        }
    }

    private static Double number(JsonObject obj, String field) throws CommandFormatException {
        JsonElement e = obj.get(field);
        if (e == null || e.isJsonNull()) {
            return null;
        }
        if (!e.isJsonPrimitive()) {
            throw new CommandFormatException("Field " + field + " must be a number");
        }
        JsonPrimitive p = e.getAsJsonPrimitive();
        if (p.isNumber()) {
            return p.getAsDouble();
        }
        if (p.isString()) {
            String text = p.getAsString().trim().replace(',', '.');
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException ex) {
                throw new CommandFormatException("Field " + field + " is not a number: " + p.getAsString(), ex);
            }
        }
        throw new CommandFormatException("Field " + field + " must be a number");
    }

    private static boolean bool(JsonObject obj, String field) throws CommandFormatException {
        JsonElement e = obj.get(field);
        if (e == null || e.isJsonNull()) {
            return false;
        }
        if (!e.isJsonPrimitive()) {
            throw new CommandFormatException("Field " + field + " must be a boolean");
        }
        JsonPrimitive p = e.getAsJsonPrimitive();
        if (p.isBoolean()) {
            return p.getAsBoolean();
        }
        if (p.isNumber()) {
            return p.getAsDouble() != 0.0;
        }
        String text = p.getAsString().trim();
        if (text.equalsIgnoreCase("true")) {
            return true;
        }
        if (text.equalsIgnoreCase("false")) {
            return false;
        }
        throw new CommandFormatException("Field " + field + " must be a boolean");
    }
}
