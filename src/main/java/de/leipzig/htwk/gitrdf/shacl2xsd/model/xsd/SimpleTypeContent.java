package de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd;

public sealed interface SimpleTypeContent extends XsdNode permits Restriction, Union {
}
