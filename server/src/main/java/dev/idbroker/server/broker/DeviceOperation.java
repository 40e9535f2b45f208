package dev.idbroker.server.broker;

/**
 * Operations of the Device Capability Broker, keyed by bus member name.
 */
public enum DeviceOperation {

    SIGN("sign"),
    GENERATE_KEY_PAIR("generateKeyPair"),
    LOAD_KEY_PAIR("loadKeyPair"),
    PERSIST_KEY("persistKey"),
    GENERATE_DERIVED_KEY("generateDerivedKey"),
    DELETE_KEY("deleteKey"),
    DECRYPT("decrypt"),
    GENERATE_PKCS10_CERT_SIGNING_REQUEST("generatePKCS10CertSigningRequest"),
    ASYMMETRIC_KEY_EXISTS("asymmetricKeyExists"),
    ASYMMETRIC_KEY_WITH_THUMBPRINT_EXISTS("asymmetricKeyWithThumbprintExists"),
    GET_ASYMMETRIC_KEY_THUMBPRINT("getAsymmetricKeyThumbprint"),
    GENERATE_ASYMMETRIC_KEY("generateAsymmetricKey"),
    GET_ASYMMETRIC_KEY_CREATION_DATE("getAsymmetricKeyCreationDate"),
    CLEAR_ASYMMETRIC_KEY("clearAsymmetricKey"),
    GET_REQUEST_CONFIRMATION("getRequestConfirmation"),
    MINT_SIGNED_ACCESS_TOKEN("mintSignedAccessToken"),
    MINT_SIGNED_HTTP_REQUEST("mintSignedHttpRequest"),
    MAKE_HTTP_REQUEST_WITH_CLIENT_TLS("makeHttpRequestWithClientTls");

    private final String wireName;

    DeviceOperation(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
