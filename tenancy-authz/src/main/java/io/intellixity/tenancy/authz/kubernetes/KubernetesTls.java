package io.intellixity.tenancy.authz.kubernetes;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509ExtendedTrustManager;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.Socket;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Collection;
import java.util.Optional;

/** JDK {@link HttpClient} construction honouring the CA bundle and skip-verify settings. */
final class KubernetesTls {
  private KubernetesTls() {}

  static HttpClient httpClient(KubernetesSettings settings) {
    Duration connect = settings.reviewTimeout().compareTo(settings.listTimeout()) < 0
        ? settings.reviewTimeout()
        : settings.listTimeout();
    HttpClient.Builder b = HttpClient.newBuilder().connectTimeout(connect);
    sslContext(settings).ifPresent(b::sslContext);
    return b.build();
  }

  static Optional<SSLContext> sslContext(KubernetesSettings settings) {
    try {
      if (settings.insecureSkipTlsVerify()) {
        SSLContext ctx = SSLContext.getInstance("TLS");
        ctx.init(null, new TrustManager[] {new TrustAll()}, new SecureRandom());
        return Optional.of(ctx);
      }
      Optional<Path> ca = settings.effectiveCaFile();
      if (ca.isEmpty()) return Optional.empty();
      return Optional.of(trusting(ca.get()));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Cannot initialise TLS for " + settings.apiServer(), e);
    }
  }

  private static SSLContext trusting(Path caFile) throws GeneralSecurityException {
    KeyStore ks = KeyStore.getInstance(KeyStore.getDefaultType());
    try (InputStream in = Files.newInputStream(caFile)) {
      ks.load(null, null);
      Collection<? extends Certificate> certs = CertificateFactory.getInstance("X.509").generateCertificates(in);
      int i = 0;
      for (Certificate c : certs) ks.setCertificateEntry("ca-" + (i++), c);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read CA file " + caFile, e);
    }
    TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
    tmf.init(ks);
    SSLContext ctx = SSLContext.getInstance("TLS");
    ctx.init(null, tmf.getTrustManagers(), new SecureRandom());
    return ctx;
  }

  /** Accepts any server chain and skips endpoint identification. */
  private static final class TrustAll extends X509ExtendedTrustManager {
    @Override public void checkClientTrusted(X509Certificate[] chain, String authType) {}
    @Override public void checkServerTrusted(X509Certificate[] chain, String authType) {}
    @Override public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {}
    @Override public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {}
    @Override public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}
    @Override public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}
    @Override public X509Certificate[] getAcceptedIssuers() { return new X509Certificate[0]; }
  }
}
