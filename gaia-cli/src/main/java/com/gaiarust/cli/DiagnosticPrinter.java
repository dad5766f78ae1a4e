package com.gaiarust.cli;

import com.gaiarust.analysis.SemanticDiagnostic;
import com.gaiarust.hir.SourceLocation;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.io.PrintWriter;
import java.util.List;

/**
 * 诊断输出：每条一行文本，或 JSON 数组
 */
public final class DiagnosticPrinter {

    private final Gson gson = new GsonBuilder().serializeNulls().setPrettyPrinting().create();

    /** file:line:column: error[CODE] item: message */
    public String format(SemanticDiagnostic d) {
        StringBuilder sb = new StringBuilder();
        SourceLocation loc = d.getLocation();
        if (loc.isKnown()) {
            sb.append(loc.getFile()).append(':').append(loc.getLine()).append(':').append(loc.getColumn()).append(": ");
        }
        sb.append(d.getSeverity().name().toLowerCase())
          .append('[').append(d.getCode()).append("] ")
          .append(d.getItem()).append(": ")
          .append(d.getMessage());
        return sb.toString();
    }

    public void printText(List<SemanticDiagnostic> diagnostics, PrintWriter out) {
        for (SemanticDiagnostic d : diagnostics) {
            out.println(format(d));
        }
    }

    public JsonArray toJson(String file, List<SemanticDiagnostic> diagnostics) {
        JsonArray array = new JsonArray();
        for (SemanticDiagnostic d : diagnostics) {
            JsonObject obj = new JsonObject();
            obj.addProperty("file", file);
            obj.addProperty("severity", d.getSeverity().name());
            obj.addProperty("code", d.getCode().name());
            obj.addProperty("item", d.getItem());
            obj.addProperty("message", d.getMessage());
            SourceLocation loc = d.getLocation();
            if (loc.isKnown()) {
                obj.addProperty("line", loc.getLine());
                obj.addProperty("column", loc.getColumn());
            }
            array.add(obj);
        }
        return array;
    }

    public void printJson(JsonArray diagnostics, PrintWriter out) {
        out.println(gson.toJson(diagnostics));
    }
}
