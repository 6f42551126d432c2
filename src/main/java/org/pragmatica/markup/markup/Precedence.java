package org.pragmatica.markup.markup;

/**
 * Decides the order in which parsers claiming the same start character are tried.
 *
 * <p>Parsers are tried in this order: extension parsers with high precedence, host parsers
 * with high precedence, host parsers with low precedence, extension parsers with low precedence.
 */
public enum Precedence {
    HIGH,
    LOW
}
