package com.libragraph.folio.markup;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites HTML named character references to numeric ones so that content documents
 * parse as XML without their DTD. The five predefined XML entities are left alone;
 * unknown names are left for the parser to reject.
 */
final class HtmlEntities {

    private static final Pattern NAMED = Pattern.compile("&([A-Za-z][A-Za-z0-9]*);");

    private static final String[] LATIN1 = (
            "nbsp iexcl cent pound curren yen brvbar sect uml copy ordf laquo not shy reg macr "
            + "deg plusmn sup2 sup3 acute micro para middot cedil sup1 ordm raquo frac14 frac12 frac34 iquest "
            + "Agrave Aacute Acirc Atilde Auml Aring AElig Ccedil Egrave Eacute Ecirc Euml Igrave Iacute Icirc Iuml "
            + "ETH Ntilde Ograve Oacute Ocirc Otilde Ouml times Oslash Ugrave Uacute Ucirc Uuml Yacute THORN szlig "
            + "agrave aacute acirc atilde auml aring aelig ccedil egrave eacute ecirc euml igrave iacute icirc iuml "
            + "eth ntilde ograve oacute ocirc otilde ouml divide oslash ugrave uacute ucirc uuml yacute thorn yuml"
    ).split(" ");

    private static final Map<String, Integer> CODES = new HashMap<>();

    static {
        for (int i = 0; i < LATIN1.length; i++) {
            CODES.put(LATIN1[i], 160 + i);
        }
        CODES.put("OElig", 338);
        CODES.put("oelig", 339);
        CODES.put("Scaron", 352);
        CODES.put("scaron", 353);
        CODES.put("Yuml", 376);
        CODES.put("fnof", 402);
        CODES.put("circ", 710);
        CODES.put("tilde", 732);
        CODES.put("ensp", 8194);
        CODES.put("emsp", 8195);
        CODES.put("thinsp", 8201);
        CODES.put("zwnj", 8204);
        CODES.put("zwj", 8205);
        CODES.put("lrm", 8206);
        CODES.put("rlm", 8207);
        CODES.put("ndash", 8211);
        CODES.put("mdash", 8212);
        CODES.put("lsquo", 8216);
        CODES.put("rsquo", 8217);
        CODES.put("sbquo", 8218);
        CODES.put("ldquo", 8220);
        CODES.put("rdquo", 8221);
        CODES.put("bdquo", 8222);
        CODES.put("dagger", 8224);
        CODES.put("Dagger", 8225);
        CODES.put("bull", 8226);
        CODES.put("hellip", 8230);
        CODES.put("permil", 8240);
        CODES.put("prime", 8242);
        CODES.put("Prime", 8243);
        CODES.put("lsaquo", 8249);
        CODES.put("rsaquo", 8250);
        CODES.put("oline", 8254);
        CODES.put("euro", 8364);
        CODES.put("trade", 8482);
        CODES.put("larr", 8592);
        CODES.put("uarr", 8593);
        CODES.put("rarr", 8594);
        CODES.put("darr", 8595);
        CODES.put("harr", 8596);
        CODES.put("minus", 8722);
        CODES.put("infin", 8734);
        CODES.put("ne", 8800);
        CODES.put("le", 8804);
        CODES.put("ge", 8805);
    }

    private HtmlEntities() {
    }

    static String toNumeric(String text) {
        if (text.indexOf('&') < 0) {
            return text;
        }
        Matcher m = NAMED.matcher(text);
        StringBuilder sb = new StringBuilder(text.length());
        while (m.find()) {
            Integer code = CODES.get(m.group(1));
            m.appendReplacement(sb, code == null ? "$0" : "&#" + code + ";");
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
