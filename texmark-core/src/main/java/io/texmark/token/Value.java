package io.texmark.token;

/** An argument or keyword-argument payload after call-tree building. */
public sealed interface Value permits Word, QuotedString, ListValue, ObjectValue, CallNode {

  int line();

  String repr();
}
