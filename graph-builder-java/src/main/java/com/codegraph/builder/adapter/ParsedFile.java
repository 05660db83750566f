package com.codegraph.builder.adapter;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.List;

/**
 * Raw declarations, calls and imports of one source file, as reported by a
 * {@link ParserAdapter}. External adapters print this document as JSON.
 *
 * Symbol keys ({@code symbol}, {@code callee}, {@code target_symbol}) are chosen by
 * the adapter and only need to be unique within its language.
 */
public class ParsedFile {

    /** Project-relative path with '/' separators. */
    @SerializedName("path")
    public String path;

    @SerializedName("declarations")
    public List<RawDeclaration> declarations;

    @SerializedName("calls")
    public List<RawCall> calls;

    @SerializedName("imports")
    public List<RawImport> imports;

    public List<RawDeclaration> getDeclarations() {
        return declarations != null ? declarations : Collections.emptyList();
    }

    public List<RawCall> getCalls() {
        return calls != null ? calls : Collections.emptyList();
    }

    public List<RawImport> getImports() {
        return imports != null ? imports : Collections.emptyList();
    }

    public static class RawDeclaration {
        @SerializedName("symbol")      public String symbol;
        @SerializedName("parent")      public String parent;      // nullable: top-level
        @SerializedName("kind")        public String kind;        // function, method, constructor, class, interface, enum, record, type, module
        @SerializedName("name")        public String name;
        @SerializedName("params")      public List<RawParameter> params;
        @SerializedName("return_type") public String returnType;  // nullable
        @SerializedName("doc")         public String doc;         // nullable
        @SerializedName("start_line")  public int startLine;
        @SerializedName("end_line")    public int endLine;
        @SerializedName("body")        public String body;
        @SerializedName("complexity")  public Integer complexity; // nullable: computed from body
        @SerializedName("supertypes")  public List<RawSupertype> supertypes;

        public List<RawParameter> getParams() {
            return params != null ? params : Collections.emptyList();
        }

        public List<RawSupertype> getSupertypes() {
            return supertypes != null ? supertypes : Collections.emptyList();
        }
    }

    public static class RawParameter {
        @SerializedName("name") public String name;
        @SerializedName("type") public String type;  // nullable

        public RawParameter() {}

        public RawParameter(String name, String type) {
            this.name = name;
            this.type = type;
        }
    }

    public static class RawSupertype {
        @SerializedName("relation") public String relation;  // extends | implements
        @SerializedName("name")     public String name;
        @SerializedName("symbol")   public String symbol;    // nullable: unresolved
    }

    public static class RawCall {
        @SerializedName("caller") public String caller;
        @SerializedName("callee") public String callee;  // nullable: unresolved
        @SerializedName("line")   public int line;
    }

    public static class RawImport {
        @SerializedName("specifier")     public String specifier;
        @SerializedName("line")          public int line;
        @SerializedName("target_path")   public String targetPath;    // nullable
        @SerializedName("target_symbol") public String targetSymbol;  // nullable
    }
}
